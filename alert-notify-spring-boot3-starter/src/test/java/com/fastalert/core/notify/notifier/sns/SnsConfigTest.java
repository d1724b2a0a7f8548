package com.fastalert.core.notify.notifier.sns;

import com.fastalert.core.receiver.DecryptFunction;
import com.fastalert.core.receiver.SecureSettingsDecryptor;
import com.fastalert.core.spi.transport.AwsAuthType;
import com.fastalert.core.template.DefaultTemplates;
import com.fastalert.exception.ReceiverConfigException;
import com.fastalert.support.TestAlerts;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SnsConfigTest {

    private static final String TOPIC = "\"topic_arn\": \"arn:aws:sns:region:0123456789:SNSTopicName\"";

    private static SnsConfig parse(String json) {
        return SnsConfig.parse(TestAlerts.settings(json), DecryptFunction.plain());
    }

    @Test
    void shouldRequireADestination() {
        assertThatThrownBy(() -> parse("{}"))
                .isInstanceOf(ReceiverConfigException.class)
                .hasMessage("must specify topicArn, targetArn, or phone number");
    }

    @Test
    void shouldRejectMalformedArns() {
        assertThatThrownBy(() -> parse("{\"topic_arn\": \"not-an-arn\"}"))
                .isInstanceOf(ReceiverConfigException.class)
                .hasMessage("invalid topic ARN provided");
        assertThatThrownBy(() -> parse("{\"target_arn\": \"arn:aws:sns\"}"))
                .isInstanceOf(ReceiverConfigException.class)
                .hasMessage("invalid target ARN provided");
    }

    @Test
    void shouldDefaultSubjectMessageAndAuth() {
        SnsConfig conf = parse("{" + TOPIC + "}");

        assertThat(conf.getSubject()).isEqualTo(DefaultTemplates.TITLE);
        assertThat(conf.getMessage()).isEqualTo(DefaultTemplates.MESSAGE);
        assertThat(conf.getConnect().getAuthType()).isEqualTo(AwsAuthType.DEFAULT);
        assertThat(conf.getAttributes()).isEmpty();
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "{\"profile\": \"default\"}|SHARED_CREDENTIALS",
            "{\"access_key\": \"a\", \"secret_key\": \"s\"}|KEYS",
            "{\"access_key\": \"a\", \"secret_key\": \"s\", \"profile\": \"default\"}|SHARED_CREDENTIALS",
            "{\"authType\": \"ec2-iam-role\"}|EC2_IAM_ROLE",
            "{\"authType\": \"grafana-assume-role\", \"role_arn\": \"arn:aws:iam::123456789012:role/r\"}|ASSUME_ROLE"
    })
    void shouldResolveAuthType(String sigv4, AwsAuthType expected) {
        assertThat(parse("{" + TOPIC + ", \"sigv4\": " + sigv4 + "}").getConnect().getAuthType()).isEqualTo(expected);
    }

    @Test
    void shouldRequireBothKeys() {
        assertThatThrownBy(() -> parse("{" + TOPIC + ", \"sigv4\": {\"access_key\": \"a\"}}"))
                .isInstanceOf(ReceiverConfigException.class)
                .hasMessage("must specify both access key and secret key");
        assertThatThrownBy(() -> parse("{" + TOPIC + ", \"sigv4\": {\"secret_key\": \"s\"}}"))
                .isInstanceOf(ReceiverConfigException.class)
                .hasMessage("must specify both access key and secret key");
    }

    @Test
    void shouldRejectUnknownAuthType() {
        assertThatThrownBy(() -> parse("{" + TOPIC + ", \"sigv4\": {\"authType\": \"magic\"}}"))
                .isInstanceOf(ReceiverConfigException.class)
                .hasMessageStartingWith("unsupported auth type");
    }

    @Test
    void shouldReadKeysFromSecureSettings() {
        SnsConfig conf = SnsConfig.parse(TestAlerts.settings("{" + TOPIC + ", \"api_url\": \"http://localstack:4566\"}"),
                new SecureSettingsDecryptor(Map.of("sigv4.access_key", "ak", "sigv4.secret_key", "sk")));

        assertThat(conf.getConnect().getAuthType()).isEqualTo(AwsAuthType.KEYS);
        assertThat(conf.getConnect().getAccessKey()).isEqualTo("ak");
        assertThat(conf.getConnect().getSecretKey()).isEqualTo("sk");
        assertThat(conf.getConnect().getEndpoint()).isEqualTo("http://localstack:4566");
    }
}
