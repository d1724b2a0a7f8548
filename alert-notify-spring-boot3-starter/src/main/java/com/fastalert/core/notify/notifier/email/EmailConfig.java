package com.fastalert.core.notify.notifier.email;

import com.fastalert.core.receiver.DecryptFunction;
import com.fastalert.core.receiver.DelimitedList;
import com.fastalert.core.receiver.Settings;
import com.fastalert.core.template.DefaultTemplates;
import com.fastalert.exception.ReceiverConfigException;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class EmailConfig {

    private final boolean singleEmail;

    private final List<String> addresses;

    private final String message;

    private final String subject;

    public static EmailConfig parse(Settings s, DecryptFunction decrypt) {
        DelimitedList addresses = s.list("addresses");
        if (addresses.isEmpty()) {
            throw new ReceiverConfigException("could not find addresses in settings");
        }
        return EmailConfig.builder()
                .singleEmail(s.bool("singleEmail"))
                .addresses(addresses.items())
                .message(s.string("message", DefaultTemplates.MESSAGE))
                .subject(s.string("subject", DefaultTemplates.TITLE))
                .build();
    }

    @Override
    public String toString() {
        return "EmailConfig{singleEmail=" + singleEmail + ", addresses=" + addresses.size() + "}";
    }
}
