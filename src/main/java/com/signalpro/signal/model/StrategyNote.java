package com.signalpro.signal.model;

import com.signalpro.shared.exception.SignalValidationException;
import lombok.Builder;
import lombok.Getter;

/**
 * 策略說明區塊
 */
@Getter
public class StrategyNote {

    public static final String DEFAULT_LINK_TEXT = "Learn more →";
    public static final String DEFAULT_LINK_URL = "https://example.com/strategy";

    private final String title;
    private final String description;
    private final String linkText;
    private final String linkUrl;

    @Builder
    private StrategyNote(String title, String description, String linkText, String linkUrl) {
        if (isBlank(title) || isBlank(description)) {
            throw new SignalValidationException("策略說明需要 title 與 description");
        }
        this.title = title;
        this.description = description;
        this.linkText = isBlank(linkText) ? DEFAULT_LINK_TEXT : linkText;
        this.linkUrl = isBlank(linkUrl) ? DEFAULT_LINK_URL : linkUrl;
    }

    public static StrategyNote of(String title, String description) {
        return builder().title(title).description(description).build();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
