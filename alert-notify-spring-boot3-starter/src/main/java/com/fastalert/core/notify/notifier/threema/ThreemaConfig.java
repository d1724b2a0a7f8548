package com.fastalert.core.notify.notifier.threema;

import com.fastalert.core.receiver.ConfigChecks;
import com.fastalert.core.receiver.DecryptFunction;
import com.fastalert.core.receiver.Settings;
import com.fastalert.core.template.DefaultTemplates;
import com.fastalert.exception.ReceiverConfigException;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class ThreemaConfig {

    private final String gatewayId;

    private final String recipientId;

    private final String apiSecret;

    private final String title;

    private final String description;

    public static ThreemaConfig parse(Settings s, DecryptFunction decrypt) {
        String gatewayId = ConfigChecks.require(s.string("gateway_id"), "could not find Threema Gateway ID in settings");
        if (!gatewayId.startsWith("*")) {
            throw new ReceiverConfigException("invalid Threema Gateway ID: Must start with a *");
        }
        if (gatewayId.length() != 8) {
            throw new ReceiverConfigException("invalid Threema Gateway ID: Must be 8 characters long");
        }
        String recipientId = ConfigChecks.require(s.string("recipient_id"), "could not find Threema Recipient ID in settings");
        if (recipientId.length() != 8) {
            throw new ReceiverConfigException("invalid Threema Recipient ID: Must be 8 characters long");
        }
        String secret = ConfigChecks.require(decrypt.decrypt("api_secret", s.string("api_secret")), "could not find Threema API secret in settings");
        return ThreemaConfig.builder()
                .gatewayId(gatewayId)
                .recipientId(recipientId)
                .apiSecret(secret)
                .title(s.string("title", DefaultTemplates.TITLE))
                .description(s.string("description", DefaultTemplates.MESSAGE))
                .build();
    }

    @Override
    public String toString() {
        return "ThreemaConfig{gatewayId=" + gatewayId + ", recipientId=" + recipientId + "}";
    }
}
