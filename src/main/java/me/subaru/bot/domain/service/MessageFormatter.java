package me.subaru.bot.domain.service;

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

import me.subaru.bot.domain.model.DiscordWebhookEvent;
import me.subaru.bot.domain.model.DownloadJob;
import me.subaru.bot.domain.model.SecurityEvent;
import me.subaru.bot.domain.model.WebhookNotifyEvent;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders outbound chat text (markdown) for every event kind, and splits long
 * replies into one message per paragraph.
 */
@Component
public class MessageFormatter {

    private static final Pattern CODE_BLOCK = Pattern.compile("```[^\\n]*\\n.*?\\n```", Pattern.DOTALL);
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n{2,}");
    private static final String PLACEHOLDER_PREFIX = "\u0000CODEBLOCK_";
    private static final String PLACEHOLDER_SUFFIX = "\u0000";
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
            .withZone(ZoneId.systemDefault());

    public String formatNotification(WebhookNotifyEvent event) {
        if (event.style() == WebhookNotifyEvent.Style.LOG) {
            return formatLog(event.severity(), event.heading(), event.message());
        }
        return formatNotify(event.severity(), event.heading(), event.message());
    }

    public String formatNotify(String priority, String title, String message) {
        return priorityMarker(priority) + " **" + orDefault(title, "Notification") + "**\n" + orDefault(message, "");
    }

    public String formatLog(String level, String source, String message) {
        String normalizedLevel = orDefault(level, "INFO").toUpperCase(Locale.ROOT);
        return "📋 **[" + normalizedLevel + "]** " + orDefault(source, "unknown") + "\n" + orDefault(message, "");
    }

    /**
     * 🔴 high, 🟡 medium, 🟢 anything else.
     */
    public String priorityMarker(String priority) {
        String normalized = priority != null ? priority.trim().toLowerCase(Locale.ROOT) : "";
        return switch (normalized) {
        case "high" -> "🔴";
        case "medium" -> "🟡";
        default -> "🟢";
        };
    }

    public String formatDiscord(DiscordWebhookEvent event) {
        StringBuilder text = new StringBuilder();
        if (event.username() != null && !event.username().isBlank()) {
            text.append("**").append(event.username().trim()).append("**\n");
        }
        if (event.content() != null && !event.content().isBlank()) {
            text.append(event.content().trim());
        }
        for (DiscordWebhookEvent.Embed embed : event.embeds()) {
            appendSeparator(text);
            if (embed.title() != null && !embed.title().isBlank()) {
                text.append("**").append(embed.title().trim()).append("**\n");
            }
            if (embed.description() != null && !embed.description().isBlank()) {
                text.append(embed.description().trim()).append('\n');
            }
            for (DiscordWebhookEvent.Field field : embed.fields()) {
                text.append("• **").append(orDefault(field.name(), "")).append(":** ")
                        .append(orDefault(field.value(), "")).append('\n');
            }
        }
        return text.toString().trim();
    }

    public String formatSecurity(SecurityEvent event) {
        return event.severity().marker() + " **" + event.title() + "**\n\n"
                + orDefault(event.message(), "") + "\n\n"
                + "_Time: " + TIMESTAMP.format(event.arrivedAt()) + "_";
    }

    public String formatJobNotification(DownloadJob job, int maxLinks) {
        String name = orDefault(job.getFilename(), job.getJobId());
        return switch (job.getState()) {
        case READY -> formatReady(job, name, maxLinks);
        case FAILED -> "❌ **Download failed**\n\n📁 " + name + "\n⚠️ "
                + orDefault(job.getFailureReason(), "unknown error");
        case EXPIRED -> "⌛ **Download expired**\n\n📁 " + name
                + "\nIt did not finish within the tracking window.";
        default -> "⏳ " + name + ": " + job.getProgress() + "%";
        };
    }

    private String formatReady(DownloadJob job, String name, int maxLinks) {
        StringBuilder text = new StringBuilder("✅ **Download complete!**\n\n📁 **").append(name).append("**\n");
        List<String> links = job.getLinks() != null ? job.getLinks() : List.of();
        if (!links.isEmpty()) {
            text.append("\n🔗 **Links:**\n");
            links.stream().limit(maxLinks).forEach(link -> text.append("• ").append(link).append('\n'));
            if (links.size() > maxLinks) {
                text.append("… and ").append(links.size() - maxLinks).append(" more");
            }
        }
        return text.toString().trim();
    }

    /**
     * Splits a reply into one message per paragraph. Fenced code blocks are never
     * split and stay inside the paragraph that contains them.
     */
    public List<String> splitParagraphs(String message) {
        if (message == null || message.isBlank()) {
            return List.of();
        }

        List<String> codeBlocks = new ArrayList<>();
        Matcher matcher = CODE_BLOCK.matcher(message);
        StringBuilder masked = new StringBuilder();
        while (matcher.find()) {
            codeBlocks.add(matcher.group());
            matcher.appendReplacement(masked,
                    Matcher.quoteReplacement(PLACEHOLDER_PREFIX + (codeBlocks.size() - 1) + PLACEHOLDER_SUFFIX));
        }
        matcher.appendTail(masked);

        List<String> parts = new ArrayList<>();
        for (String paragraph : PARAGRAPH_BREAK.split(masked.toString())) {
            String trimmed = paragraph.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            parts.add(restoreCodeBlocks(trimmed, codeBlocks));
        }
        return parts;
    }

    private String restoreCodeBlocks(String paragraph, List<String> codeBlocks) {
        String restored = paragraph;
        for (int i = 0; i < codeBlocks.size(); i++) {
            restored = restored.replace(PLACEHOLDER_PREFIX + i + PLACEHOLDER_SUFFIX, codeBlocks.get(i));
        }
        return restored;
    }

    private void appendSeparator(StringBuilder text) {
        if (text.length() > 0) {
            text.append("\n\n");
        }
    }

    private String orDefault(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }
}
