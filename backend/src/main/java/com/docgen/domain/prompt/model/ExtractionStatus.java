package com.docgen.domain.prompt.model;

public enum ExtractionStatus {
    EXTRACTED,
    NO_PROMPTS,
    NO_JSON,
    UNPARSEABLE
}
