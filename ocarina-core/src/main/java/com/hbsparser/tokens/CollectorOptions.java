package com.hbsparser.tokens;

/**
 * Options for {@link TemplateTokenCollector}.
 *
 * @param ignoreThisPaths skip curly paths whose head is {@code this} ({@code {{this.title}}})
 */
public record CollectorOptions(boolean ignoreThisPaths) {

    public static final CollectorOptions DEFAULT = new CollectorOptions(false);
}
