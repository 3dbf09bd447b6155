package safecode.generation;

import safecode.model.PageType;
import safecode.model.TestType;

/**
 * What to generate: a test of {@code testType} for one brand page, described in prose.
 */
public record GenerationRequest(long brandId, PageType pageType, TestType testType, String description) {

    public GenerationRequest {
        description = description != null ? description : "";
    }
}
