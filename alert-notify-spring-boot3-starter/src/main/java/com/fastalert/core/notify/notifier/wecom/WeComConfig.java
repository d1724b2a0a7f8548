package com.fastalert.core.notify.notifier.wecom;

import com.fastalert.core.receiver.DecryptFunction;
import com.fastalert.core.receiver.Settings;
import com.fastalert.core.template.DefaultTemplates;
import com.fastalert.exception.ReceiverConfigException;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class WeComConfig {

    public static final String DEFAULT_ENDPOINT = "https://qyapi.weixin.qq.com";

    public static final String CHANNEL_GROUP_ROBOT = "groupRobot";
    public static final String CHANNEL_API_APP = "apiapp";

    public static final String MSG_TYPE_MARKDOWN = "markdown";
    public static final String MSG_TYPE_TEXT = "text";

    private final String channel;

    private final String endpointUrl;

    private final String url;

    private final String agentId;

    private final String corpId;

    private final String secret;

    private final String msgType;

    private final String message;

    private final String title;

    private final String toUser;

    public static WeComConfig parse(Settings s, DecryptFunction decrypt) {
        String msgType = s.string("msgtype");
        if (!MSG_TYPE_MARKDOWN.equals(msgType) && !MSG_TYPE_TEXT.equals(msgType)) {
            msgType = MSG_TYPE_MARKDOWN;
        }
        String url = decrypt.decrypt("url", s.string("url"));
        String secret = decrypt.decrypt("secret", s.string("secret"));
        if (url.isEmpty() && secret.isEmpty()) {
            throw new ReceiverConfigException("either url or secret is required");
        }
        String channel = CHANNEL_GROUP_ROBOT;
        String agentId = s.string("agent_id");
        String corpId = s.string("corp_id");
        if (url.isEmpty()) {
            channel = CHANNEL_API_APP;
            if (agentId.isEmpty()) {
                throw new ReceiverConfigException("could not find AgentID in settings");
            }
            if (corpId.isEmpty()) {
                throw new ReceiverConfigException("could not find CorpID in settings");
            }
        }
        return WeComConfig.builder()
                .channel(channel)
                .endpointUrl(s.string("endpointUrl", DEFAULT_ENDPOINT))
                .url(url)
                .agentId(agentId)
                .corpId(corpId)
                .secret(secret)
                .msgType(msgType)
                .message(s.string("message", DefaultTemplates.MESSAGE))
                .title(s.string("title", DefaultTemplates.TITLE))
                .toUser(s.string("touser", "@all"))
                .build();
    }

    public boolean isApiApp() {
        return CHANNEL_API_APP.equals(channel);
    }

    @Override
    public String toString() {
        return "WeComConfig{channel=" + channel + ", msgType=" + msgType + "}";
    }
}
