package com.team.testcaseimport.util;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts step text into the XML stored in Microsoft.VSTS.TCM.Steps.
 *
 * Input is one step per line, either "N. action|expected" or plain text.
 * Plain lines and lines without an expected part get a default expected result.
 */
public final class TestStepsXmlEncoder {

    public static final String DEFAULT_EXPECTED = "Verify step completes successfully";

    private static final Pattern NUMBERED_STEP = Pattern.compile("^(\\d+)\\.\\s*(.*)$");

    private TestStepsXmlEncoder() {
    }

    public static String encode(String steps) {
        List<String> lines = steps == null ? List.of() : steps.lines()
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .toList();

        StringBuilder xml = new StringBuilder();
        xml.append("<steps id=\"0\" last=\"").append(lines.size()).append("\">");

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            String action = line;
            String expected = DEFAULT_EXPECTED;

            Matcher matcher = NUMBERED_STEP.matcher(line);
            if (matcher.matches()) {
                String body = matcher.group(2);
                int pipe = body.indexOf('|');
                if (pipe >= 0) {
                    action = body.substring(0, pipe).trim();
                    String rest = body.substring(pipe + 1).trim();
                    expected = rest.isEmpty() ? DEFAULT_EXPECTED : rest;
                } else {
                    action = body.trim();
                }
            }

            xml.append("<step id=\"").append(i + 1).append("\" type=\"ActionStep\">")
                    .append("<parameterizedString isformatted=\"true\">").append(escapeXml(action))
                    .append("</parameterizedString>")
                    .append("<parameterizedString isformatted=\"true\">").append(escapeXml(expected))
                    .append("</parameterizedString>")
                    .append("<description/>")
                    .append("</step>");
        }

        xml.append("</steps>");
        return xml.toString();
    }

    public static String escapeXml(String value) {
        StringBuilder escaped = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            switch (c) {
                case '<' -> escaped.append("&lt;");
                case '>' -> escaped.append("&gt;");
                case '&' -> escaped.append("&amp;");
                case '\'' -> escaped.append("&apos;");
                case '"' -> escaped.append("&quot;");
                default -> escaped.append(c);
            }
        }
        return escaped.toString();
    }
}
