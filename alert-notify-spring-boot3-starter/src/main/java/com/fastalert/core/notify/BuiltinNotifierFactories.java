package com.fastalert.core.notify;

import com.fastalert.core.notify.notifier.alertmanager.AlertmanagerConfig;
import com.fastalert.core.notify.notifier.alertmanager.AlertmanagerNotifier;
import com.fastalert.core.notify.notifier.dingding.DingDingConfig;
import com.fastalert.core.notify.notifier.dingding.DingDingNotifier;
import com.fastalert.core.notify.notifier.discord.DiscordConfig;
import com.fastalert.core.notify.notifier.discord.DiscordNotifier;
import com.fastalert.core.notify.notifier.dooray.DoorayConfig;
import com.fastalert.core.notify.notifier.dooray.DoorayNotifier;
import com.fastalert.core.notify.notifier.email.EmailConfig;
import com.fastalert.core.notify.notifier.email.EmailNotifier;
import com.fastalert.core.notify.notifier.googlechat.GoogleChatConfig;
import com.fastalert.core.notify.notifier.googlechat.GoogleChatNotifier;
import com.fastalert.core.notify.notifier.jira.JiraConfig;
import com.fastalert.core.notify.notifier.jira.JiraNotifier;
import com.fastalert.core.notify.notifier.kafka.KafkaConfig;
import com.fastalert.core.notify.notifier.kafka.KafkaNotifier;
import com.fastalert.core.notify.notifier.line.LineConfig;
import com.fastalert.core.notify.notifier.line.LineNotifier;
import com.fastalert.core.notify.notifier.mqtt.MqttConfig;
import com.fastalert.core.notify.notifier.mqtt.MqttNotifier;
import com.fastalert.core.notify.notifier.opsgenie.OpsgenieConfig;
import com.fastalert.core.notify.notifier.opsgenie.OpsgenieNotifier;
import com.fastalert.core.notify.notifier.pagerduty.PagerDutyConfig;
import com.fastalert.core.notify.notifier.pagerduty.PagerDutyNotifier;
import com.fastalert.core.notify.notifier.pushover.PushoverConfig;
import com.fastalert.core.notify.notifier.pushover.PushoverNotifier;
import com.fastalert.core.notify.notifier.sensugo.SensuGoConfig;
import com.fastalert.core.notify.notifier.sensugo.SensuGoNotifier;
import com.fastalert.core.notify.notifier.slack.SlackConfig;
import com.fastalert.core.notify.notifier.slack.SlackNotifier;
import com.fastalert.core.notify.notifier.sns.SnsConfig;
import com.fastalert.core.notify.notifier.sns.SnsNotifier;
import com.fastalert.core.notify.notifier.teams.TeamsConfig;
import com.fastalert.core.notify.notifier.teams.TeamsNotifier;
import com.fastalert.core.notify.notifier.telegram.TelegramConfig;
import com.fastalert.core.notify.notifier.telegram.TelegramNotifier;
import com.fastalert.core.notify.notifier.threema.ThreemaConfig;
import com.fastalert.core.notify.notifier.threema.ThreemaNotifier;
import com.fastalert.core.notify.notifier.victorops.VictorOpsConfig;
import com.fastalert.core.notify.notifier.victorops.VictorOpsNotifier;
import com.fastalert.core.notify.notifier.webex.WebexConfig;
import com.fastalert.core.notify.notifier.webex.WebexNotifier;
import com.fastalert.core.notify.notifier.webhook.WebhookConfig;
import com.fastalert.core.notify.notifier.webhook.WebhookNotifier;
import com.fastalert.core.notify.notifier.wecom.WeComConfig;
import com.fastalert.core.notify.notifier.wecom.WeComNotifier;
import com.fastalert.core.spi.notify.NotifierFactory;

import java.util.List;

/**
 * 内置接收器类型
 */
public final class BuiltinNotifierFactories {

    private BuiltinNotifierFactories() {}

    public static List<NotifierFactory> all() {
        return List.of(
                NotifierFactory.of(WebhookNotifier.TYPE, (m, s, d, deps) -> new WebhookNotifier(m, WebhookConfig.parse(s, d), deps)),
                NotifierFactory.of(SlackNotifier.TYPE, (m, s, d, deps) -> new SlackNotifier(m, SlackConfig.parse(s, d), deps)),
                NotifierFactory.of(DiscordNotifier.TYPE, (m, s, d, deps) -> new DiscordNotifier(m, DiscordConfig.parse(s, d), deps)),
                NotifierFactory.of(TeamsNotifier.TYPE, (m, s, d, deps) -> new TeamsNotifier(m, TeamsConfig.parse(s, d), deps)),
                NotifierFactory.of(TelegramNotifier.TYPE, (m, s, d, deps) -> new TelegramNotifier(m, TelegramConfig.parse(s, d), deps)),
                NotifierFactory.of(WeComNotifier.TYPE, (m, s, d, deps) -> new WeComNotifier(m, WeComConfig.parse(s, d), deps)),
                NotifierFactory.of(VictorOpsNotifier.TYPE, (m, s, d, deps) -> new VictorOpsNotifier(m, VictorOpsConfig.parse(s, d), deps)),
                NotifierFactory.of(LineNotifier.TYPE, (m, s, d, deps) -> new LineNotifier(m, LineConfig.parse(s, d), deps)),
                NotifierFactory.of(ThreemaNotifier.TYPE, (m, s, d, deps) -> new ThreemaNotifier(m, ThreemaConfig.parse(s, d), deps)),
                NotifierFactory.of(DoorayNotifier.TYPE, (m, s, d, deps) -> new DoorayNotifier(m, DoorayConfig.parse(s, d), deps)),
                NotifierFactory.of(WebexNotifier.TYPE, (m, s, d, deps) -> new WebexNotifier(m, WebexConfig.parse(s, d), deps)),
                NotifierFactory.of(EmailNotifier.TYPE, (m, s, d, deps) -> new EmailNotifier(m, EmailConfig.parse(s, d), deps)),
                NotifierFactory.of(PagerDutyNotifier.TYPE, (m, s, d, deps) -> new PagerDutyNotifier(m, PagerDutyConfig.parse(s, d), deps)),
                NotifierFactory.of(OpsgenieNotifier.TYPE, (m, s, d, deps) -> new OpsgenieNotifier(m, OpsgenieConfig.parse(s, d), deps)),
                NotifierFactory.of(JiraNotifier.TYPE, (m, s, d, deps) -> new JiraNotifier(m, JiraConfig.parse(s, d), deps)),
                NotifierFactory.of(KafkaNotifier.TYPE, (m, s, d, deps) -> new KafkaNotifier(m, KafkaConfig.parse(s, d), deps)),
                NotifierFactory.of(MqttNotifier.TYPE, (m, s, d, deps) -> new MqttNotifier(m, MqttConfig.parse(s, d), deps)),
                NotifierFactory.of(GoogleChatNotifier.TYPE, (m, s, d, deps) -> new GoogleChatNotifier(m, GoogleChatConfig.parse(s, d), deps)),
                NotifierFactory.of(DingDingNotifier.TYPE, (m, s, d, deps) -> new DingDingNotifier(m, DingDingConfig.parse(s, d), deps)),
                NotifierFactory.of(SensuGoNotifier.TYPE, (m, s, d, deps) -> new SensuGoNotifier(m, SensuGoConfig.parse(s, d), deps)),
                NotifierFactory.of(PushoverNotifier.TYPE, (m, s, d, deps) -> new PushoverNotifier(m, PushoverConfig.parse(s, d), deps)),
                NotifierFactory.of(AlertmanagerNotifier.TYPE, (m, s, d, deps) -> new AlertmanagerNotifier(m, AlertmanagerConfig.parse(s, d), deps)),
                NotifierFactory.of(SnsNotifier.TYPE, (m, s, d, deps) -> new SnsNotifier(m, SnsConfig.parse(s, d), deps))
        );
    }
}
