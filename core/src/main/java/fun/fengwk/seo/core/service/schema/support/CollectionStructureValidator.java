package fun.fengwk.seo.core.service.schema.support;

import java.util.List;
import java.util.Map;

/**
 * Validators for entities built from a list of items: FAQ questions, HowTo steps and breadcrumb entries.
 *
 * <p>Items are addressed by their zero based index in messages.
 *
 * @author fengwk
 */
public class CollectionStructureValidator {

    public void validateFaq(Map<String, Object> faq, ValidationCollector collector) {
        Object mainEntity = faq.get("mainEntity");
        if (SchemaValues.isStrictEmpty(mainEntity)) {
            return;
        }
        if (!SchemaValues.isList(mainEntity) && !SchemaValues.isMap(mainEntity)) {
            collector.issue("mainEntity must be an array of Question items or a single Question object.");
            return;
        }
        List<Object> questions = SchemaValues.asList(mainEntity);
        for (int i = 0; i < questions.size(); i++) {
            Object question = questions.get(i);
            if (!SchemaValues.hasType(question, "Question")) {
                collector.issue("Item " + i + " in mainEntity should have @type: Question (found '"
                    + SchemaValues.typeOf(question) + "').");
                continue;
            }
            Map<String, Object> fields = SchemaValues.asMap(question);
            if (SchemaValues.isStrictEmpty(fields.get("name"))) {
                collector.issue("Question " + i + " is missing the required 'name' property.");
            }
            Object answer = fields.get("acceptedAnswer");
            if (SchemaValues.isStrictEmpty(answer)) {
                collector.issue("Question " + i + " is missing the required 'acceptedAnswer' property.");
                continue;
            }
            if (!SchemaValues.hasType(answer, "Answer")) {
                collector.issue("Answer for question " + i + " should have @type: Answer.");
            }
            if (SchemaValues.isStrictEmpty(SchemaValues.asMap(answer).get("text"))) {
                collector.issue("Answer for question " + i + " is missing the required 'text' property.");
            }
        }
    }

    public void validateHowTo(Map<String, Object> howTo, ValidationCollector collector) {
        Object step = howTo.get("step");
        if (SchemaValues.isStrictEmpty(step)) {
            return;
        }
        List<Object> steps = SchemaValues.asList(step);
        for (int i = 0; i < steps.size(); i++) {
            Object item = steps.get(i);
            if (SchemaValues.hasType(item, "HowToSection")) {
                continue;
            }
            if (!SchemaValues.hasType(item, "HowToStep")) {
                collector.issue("HowToStep " + i + " should have @type: HowToStep.");
                continue;
            }
            Map<String, Object> fields = SchemaValues.asMap(item);
            if (SchemaValues.isStrictEmpty(fields.get("text"))) {
                collector.issue("HowToStep " + i + " is missing the required 'text' property.");
            }
            if (SchemaValues.isStrictEmpty(fields.get("name"))) {
                collector.warning("HowToStep " + i + " is missing the recommended 'name' property.");
            }
        }
    }

    public void validateBreadcrumb(Map<String, Object> breadcrumb, ValidationCollector collector) {
        Object elements = breadcrumb.get("itemListElement");
        if (SchemaValues.isStrictEmpty(elements)) {
            return;
        }
        if (!SchemaValues.isList(elements) && !SchemaValues.isMap(elements)) {
            collector.issue("itemListElement must be an array of ListItem items or a single ListItem object.");
            return;
        }
        List<Object> items = SchemaValues.asList(elements);
        int expectedPosition = 1;
        for (int i = 0; i < items.size(); i++, expectedPosition++) {
            Object item = items.get(i);
            if (!SchemaValues.hasType(item, "ListItem")) {
                collector.issue("ListItem " + i + " should have @type: ListItem.");
            }
            Map<String, Object> fields = SchemaValues.asMap(item);
            Object position = fields.get("position");
            if (SchemaValues.isStrictEmpty(position)) {
                collector.issue("ListItem " + i + " is missing required 'position' property.");
            } else {
                Double actual = SchemaValues.toDouble(position);
                if (actual == null || actual != expectedPosition) {
                    collector.warning("ListItem " + i + " has incorrect position. Expected position " + expectedPosition
                        + " but found " + SchemaValues.display(position) + ". Positions should be sequential starting from 1.");
                }
            }
            if (SchemaValues.isStrictEmpty(fields.get("item"))) {
                collector.issue("ListItem " + i + " is missing required 'item' property.");
            }
        }
    }

}
