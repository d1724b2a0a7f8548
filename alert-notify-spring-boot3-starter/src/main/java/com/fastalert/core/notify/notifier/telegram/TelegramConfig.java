package com.fastalert.core.notify.notifier.telegram;

import com.fastalert.core.receiver.ConfigChecks;
import com.fastalert.core.receiver.DecryptFunction;
import com.fastalert.core.receiver.Settings;
import com.fastalert.core.template.DefaultTemplates;
import com.fastalert.exception.ReceiverConfigException;
import lombok.Builder;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Builder
public class TelegramConfig {

    public static final String DEFAULT_PARSE_MODE = "HTML";

    // None 表示不设置 parse_mode
    private static final Map<String, String> PARSE_MODES = new LinkedHashMap<>();

    static {
        PARSE_MODES.put("Markdown", "Markdown");
        PARSE_MODES.put("MarkdownV2", "MarkdownV2");
        PARSE_MODES.put("HTML", "HTML");
        PARSE_MODES.put("None", "");
    }

    private final String botToken;

    private final String chatId;

    private final String message;

    private final String parseMode;

    private final boolean disableNotifications;

    public static TelegramConfig parse(Settings s, DecryptFunction decrypt) {
        String token = ConfigChecks.require(decrypt.decrypt("bottoken", s.string("bottoken")), "could not find Bot Token in settings");
        String chatId = ConfigChecks.require(s.string("chatid"), "could not find Chat Id in settings");
        String raw = s.string("parse_mode", DEFAULT_PARSE_MODE);
        String parseMode = null;
        for (Map.Entry<String, String> e : PARSE_MODES.entrySet()) {
            if (e.getKey().equalsIgnoreCase(raw)) {
                parseMode = e.getValue();
                break;
            }
        }
        if (parseMode == null) {
            throw new ReceiverConfigException("unknown parse_mode, must be Markdown, MarkdownV2, HTML or None");
        }
        return TelegramConfig.builder()
                .botToken(token)
                .chatId(chatId)
                .message(s.string("message", DefaultTemplates.MESSAGE))
                .parseMode(parseMode)
                .disableNotifications(s.bool("disable_notifications"))
                .build();
    }

    @Override
    public String toString() {
        return "TelegramConfig{chatId=" + chatId + ", parseMode=" + parseMode + "}";
    }
}
