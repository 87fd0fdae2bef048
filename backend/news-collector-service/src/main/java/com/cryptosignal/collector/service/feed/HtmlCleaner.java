package com.cryptosignal.collector.service.feed;

import org.jsoup.Jsoup;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * 피드 텍스트 정리: HTML 태그 제거, 엔티티 디코딩, 공백 정규화, 길이 제한
 */
@Component
public class HtmlCleaner {

    public static final int MAX_TITLE_LENGTH = 1000;
    public static final int MAX_DESCRIPTION_LENGTH = 5000;

    private static final Pattern CDATA_MARKERS = Pattern.compile("<!\\[CDATA\\[|\\]\\]>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int ENTITY_DECODE_PASSES = 3;

    /**
     * Strips markup and returns plain, single-spaced text. Null becomes "".
     */
    public String clean(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        String stripped = CDATA_MARKERS.matcher(text).replaceAll("");
        stripped = Jsoup.parse(stripped).text();

        // 이중 인코딩된 엔티티 (&amp;amp; 등)
        for (int i = 0; i < ENTITY_DECODE_PASSES; i++) {
            String decoded = Parser.unescapeEntities(stripped, false);
            if (decoded.equals(stripped)) {
                break;
            }
            stripped = decoded;
        }

        stripped = stripped.replace("\u0000", "");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    /**
     * Cuts text to at most maxLength characters, preferring a word boundary in the second half,
     * and appends "...".
     */
    public String truncate(String text, int maxLength) {
        if (text == null || maxLength <= 0 || text.length() <= maxLength) {
            return text;
        }
        if (maxLength <= 3) {
            return text.substring(0, maxLength);
        }

        int end = maxLength - 3;
        if (Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        String truncated = text.substring(0, end);

        int lastSpace = truncated.lastIndexOf(' ');
        if (lastSpace > maxLength / 2) {
            truncated = truncated.substring(0, lastSpace);
        }
        return truncated.trim() + "...";
    }

    public String sanitizeForStorage(String text, int maxLength) {
        return truncate(clean(text), maxLength);
    }
}
