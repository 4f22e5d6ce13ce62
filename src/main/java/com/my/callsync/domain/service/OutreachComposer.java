package com.my.callsync.domain.service;

import java.util.List;

/**
 * 초안 본문의 {@value #PLACEHOLDER} 자리에 계산된 가용 시간 문구를 넣는다. 날짜와 시각은 항상 이 경로로만 들어간다.
 */
public class OutreachComposer {

    public static final String PLACEHOLDER = "{{AVAILABILITY}}";
    static final String CLOSING_LINE = "Happy to work around your schedule as well.";
    static final String SIGN_OFF = "Best,";

    public String compose(String draftBody, List<String> availabilityLines) {
        String body = draftBody == null ? "" : draftBody;
        String replacement = String.join("\n", availabilityLines) + "\n" + CLOSING_LINE;
        int placeholderIndex = body.indexOf(PLACEHOLDER);
        if (placeholderIndex >= 0) {
            return body.substring(0, placeholderIndex) + replacement
                    + body.substring(placeholderIndex + PLACEHOLDER.length());
        }
        int signOffIndex = body.lastIndexOf(SIGN_OFF);
        if (signOffIndex > 0) {
            return body.substring(0, signOffIndex) + "\n" + replacement + "\n\n" + body.substring(signOffIndex);
        }
        return body + "\n\n" + replacement;
    }
}
