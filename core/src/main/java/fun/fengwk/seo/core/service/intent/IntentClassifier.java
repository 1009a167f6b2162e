package fun.fengwk.seo.core.service.intent;

import fun.fengwk.seo.core.service.content.model.ExtractedContent;
import fun.fengwk.seo.core.service.intent.model.IntentClassification;
import fun.fengwk.seo.core.service.intent.model.IntentProfile;

/**
 * @author fengwk
 */
public interface IntentClassifier {

    /**
     * Classifies the search intent behind a keyword, a blank keyword classifies as informational.
     *
     * @param keyword primary keyword
     * @param postType content type such as post, page or product, may be null
     */
    IntentClassification classify(String keyword, String postType);

    /**
     * Classifies the keyword and scores how well the extracted content satisfies the detected intent.
     *
     * @param content output of the content extractor, its region and text feed the satisfaction markers
     */
    IntentProfile analyze(String keyword, String postType, ExtractedContent content);

}
