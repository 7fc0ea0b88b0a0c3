package com.flagship.missed_call.webhook;

import org.springframework.web.util.HtmlUtils;

/**
 * Small builder for TwiML documents. Every value is XML-escaped.
 */
final class TwimlWriter {

    private final StringBuilder xml = new StringBuilder("<?xml version=\"1.0\" encoding=\"UTF-8\"?><Response>");

    TwimlWriter say(String text) {
        xml.append("<Say voice=\"alice\">").append(escape(text)).append("</Say>");
        return this;
    }

    TwimlWriter play(String url) {
        xml.append("<Play>").append(escape(url)).append("</Play>");
        return this;
    }

    TwimlWriter record(String actionUrl, int maxLengthSeconds, int timeoutSeconds) {
        xml.append("<Record action=\"").append(escape(actionUrl))
                .append("\" method=\"POST\" maxLength=\"").append(maxLengthSeconds)
                .append("\" timeout=\"").append(timeoutSeconds)
                .append("\" playBeep=\"true\"/>");
        return this;
    }

    TwimlWriter hangup() {
        xml.append("<Hangup/>");
        return this;
    }

    String build() {
        return xml + "</Response>";
    }

    static String escape(String value) {
        return value == null ? "" : HtmlUtils.htmlEscape(value, "UTF-8");
    }
}
