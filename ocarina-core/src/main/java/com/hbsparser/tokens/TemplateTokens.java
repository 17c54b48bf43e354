package com.hbsparser.tokens;

import com.hbsparser.Parser;
import com.hbsparser.TemplateSyntaxException;
import com.hbsparser.ast.Template;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Entry points from template source text to invocation tokens.
 *
 * <p>Extraction is all-or-nothing: a template that fails to parse raises
 * {@link TemplateSyntaxException} and yields no tokens.</p>
 */
public final class TemplateTokens {
    private static final Logger logger = LogManager.getLogger(TemplateTokens.class);

    private TemplateTokens() {
        // Utility class
    }

    public static List<String> extractTokensFromTemplate(String source) {
        return extractTokensFromTemplate(source, CollectorOptions.DEFAULT);
    }

    public static List<String> extractTokensFromTemplate(String source, CollectorOptions options) {
        return extractTokenOccurrences(source, options).stream().map(TokenOccurrence::name).toList();
    }

    public static List<TokenOccurrence> extractTokenOccurrences(String source) {
        return extractTokenOccurrences(source, CollectorOptions.DEFAULT);
    }

    public static List<TokenOccurrence> extractTokenOccurrences(String source, CollectorOptions options) {
        Template template = Parser.parse(source);
        List<TokenOccurrence> occurrences = new TemplateTokenCollector(options).collectOccurrences(template);
        logger.debug("Extracted {} tokens from {} chars of template source", occurrences.size(), source.length());
        return occurrences;
    }
}
