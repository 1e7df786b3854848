package me.subaru.bot.adapter.inbound.matrix;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts the small Markdown subset the bot produces into
 * {@code org.matrix.custom.html}.
 *
 * <p>
 * Handles fenced and inline code, bold, italic, strikethrough, links and
 * headers; newlines become {@code <br/>} outside of code blocks. Returns
 * {@link #NO_FORMATTING} when the text carries no markup, so the caller can
 * send plain {@code body} only.
 */
public final class MatrixHtmlFormatter {

    public static final String NO_FORMATTING = "";

    private MatrixHtmlFormatter() {
    }

    private static final Pattern CODE_BLOCK_PATTERN = Pattern.compile(
            "```(\\w*)\\n?([\\s\\S]*?)```");

    private static final Pattern INLINE_CODE_PATTERN = Pattern.compile(
            "`([^`\n]+)`");

    private static final Pattern LINK_PATTERN = Pattern.compile(
            "\\[([^]]+)]\\((https?://[^)\\s]+)\\)");

    private static final Pattern BOLD_PATTERN = Pattern.compile(
            "\\*\\*(.+?)\\*\\*|__(.+?)__");

    private static final Pattern ITALIC_PATTERN = Pattern.compile(
            "(?<![\\w*])\\*([^*\n]+?)\\*(?![\\w*])");

    // _italic_ but not file_name_path
    private static final Pattern ITALIC_UNDERSCORE_PATTERN = Pattern.compile(
            "(?<![\\w])_([^_\n]+?)_(?![\\w])");

    private static final Pattern STRIKETHROUGH_PATTERN = Pattern.compile(
            "~~(.+?)~~");

    private static final Pattern HEADER_PATTERN = Pattern.compile(
            "(?m)^(#{1,6})\\s+(.+)$");

    private static final String CODE_BLOCK_PLACEHOLDER = "\uE000CB";
    private static final String INLINE_CODE_PLACEHOLDER = "\uE000IC";

    public static String format(String text) {
        if (text == null || text.isBlank()) {
            return NO_FORMATTING;
        }

        List<String> codeBlocks = new ArrayList<>();
        Matcher m = CODE_BLOCK_PATTERN.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String language = m.group(1);
            String code = escapeHtml(m.group(2));
            String open = language.isEmpty() ? "<pre><code>" : "<pre><code class=\"language-" + language + "\">";
            codeBlocks.add(open + code + "</code></pre>");
            m.appendReplacement(sb, CODE_BLOCK_PLACEHOLDER + (codeBlocks.size() - 1) + CODE_BLOCK_PLACEHOLDER);
        }
        m.appendTail(sb);
        String result = sb.toString();

        List<String> inlineCodes = new ArrayList<>();
        m = INLINE_CODE_PATTERN.matcher(result);
        sb = new StringBuilder();
        while (m.find()) {
            inlineCodes.add("<code>" + escapeHtml(m.group(1)) + "</code>");
            m.appendReplacement(sb, INLINE_CODE_PLACEHOLDER + (inlineCodes.size() - 1) + INLINE_CODE_PLACEHOLDER);
        }
        m.appendTail(sb);
        result = sb.toString();

        String escaped = escapeHtml(result);
        result = BOLD_PATTERN.matcher(escaped).replaceAll(mr -> {
            String content = mr.group(1) != null ? mr.group(1) : mr.group(2);
            return Matcher.quoteReplacement("<strong>" + content + "</strong>");
        });
        result = ITALIC_PATTERN.matcher(result).replaceAll("<em>$1</em>");
        result = ITALIC_UNDERSCORE_PATTERN.matcher(result).replaceAll("<em>$1</em>");
        result = STRIKETHROUGH_PATTERN.matcher(result).replaceAll("<del>$1</del>");
        result = LINK_PATTERN.matcher(result).replaceAll("<a href=\"$2\">$1</a>");
        result = HEADER_PATTERN.matcher(result).replaceAll(mr -> {
            int level = mr.group(1).length();
            return Matcher.quoteReplacement("<h" + level + ">" + mr.group(2) + "</h" + level + ">");
        });

        boolean marked = !codeBlocks.isEmpty() || !inlineCodes.isEmpty() || !result.equals(escaped);
        if (!marked) {
            return NO_FORMATTING;
        }

        result = result.replace("\n", "<br/>");
        for (int i = 0; i < inlineCodes.size(); i++) {
            result = result.replace(INLINE_CODE_PLACEHOLDER + i + INLINE_CODE_PLACEHOLDER, inlineCodes.get(i));
        }
        for (int i = 0; i < codeBlocks.size(); i++) {
            result = result.replace(CODE_BLOCK_PLACEHOLDER + i + CODE_BLOCK_PLACEHOLDER, codeBlocks.get(i));
        }
        return result.strip();
    }

    static String escapeHtml(String text) {
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;");
    }
}
