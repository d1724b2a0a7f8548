package com.fastalert.core.notify;

import com.fastalert.core.failure.RouterFailureDecider;
import com.fastalert.core.failure.decider.UnknownHandler;
import com.fastalert.core.guard.GuardedNotifyExecutor;
import com.fastalert.core.metric.NotifyMetrics;
import com.fastalert.core.receiver.DecryptFunction;
import com.fastalert.core.receiver.ReceiverMetadata;
import com.fastalert.core.spi.notify.NotifierFactory;
import com.fastalert.exception.ReceiverConfigException;
import com.fastalert.exception.ReceiverInitException;
import com.fastalert.support.RecordingTransport;
import com.fastalert.support.StubNotifier;
import com.fastalert.support.TestAlerts;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReceiverRegistryTest {

    private ReceiverRegistry registry(List<NotifierFactory> factories) {
        return new ReceiverRegistry(factories, TestAlerts.deps(new RecordingTransport()),
                new RouterFailureDecider(List.of(new UnknownHandler())), GuardedNotifyExecutor.disabled(), NotifyMetrics.noop());
    }

    private static ReceiverMetadata meta(String name, String type) {
        return ReceiverMetadata.builder().uid("uid-" + name).name(name).type(type).build();
    }

    @Test
    void shouldKnowAllBuiltinTypes() {
        assertThat(registry(BuiltinNotifierFactories.all()).supportedTypes()).containsExactly(
                "dingding", "discord", "dooray", "email", "googlechat", "jira", "kafka", "line", "mqtt",
                "opsgenie", "pagerduty", "prometheus-alertmanager", "pushover", "sensugo", "slack", "sns",
                "teams", "telegram", "threema", "victorops", "webex", "webhook", "wecom");
    }

    @Test
    void shouldRegisterAndLookUpByName() {
        ReceiverRegistry registry = registry(BuiltinNotifierFactories.all());

        Integration integration = registry.register(meta("ops", "webhook"), TestAlerts.json("{\"url\": \"http://h\"}"), DecryptFunction.plain());

        assertThat(registry.get("ops")).containsSame(integration);
        assertThat(registry.get("missing")).isEmpty();
        assertThat(registry.all()).containsExactly(integration);
        assertThat(integration.type()).isEqualTo("webhook");
    }

    @Test
    void shouldRejectUnknownType() {
        assertThatThrownBy(() -> registry(BuiltinNotifierFactories.all())
                .register(meta("ops", "carrier-pigeon"), TestAlerts.json("{}"), DecryptFunction.plain()))
                .isInstanceOfSatisfying(ReceiverInitException.class, e -> {
                    assertThat(e.getReason()).isEqualTo("notifier type not supported");
                    assertThat(e.getReceiverType()).isEqualTo("carrier-pigeon");
                });
    }

    @Test
    void shouldRejectDuplicateName() {
        ReceiverRegistry registry = registry(BuiltinNotifierFactories.all());
        registry.register(meta("ops", "webhook"), TestAlerts.json("{\"url\": \"http://h\"}"), DecryptFunction.plain());

        assertThatThrownBy(() -> registry.register(meta("ops", "webhook"), TestAlerts.json("{\"url\": \"http://h\"}"), DecryptFunction.plain()))
                .isInstanceOf(ReceiverInitException.class)
                .hasMessageContaining("receiver name is already in use");
    }

    @Test
    void shouldWrapConfigErrors() {
        assertThatThrownBy(() -> registry(BuiltinNotifierFactories.all())
                .register(meta("ops", "webhook"), TestAlerts.json("{}"), DecryptFunction.plain()))
                .isInstanceOfSatisfying(ReceiverInitException.class, e -> {
                    assertThat(e.getCause()).isInstanceOf(ReceiverConfigException.class);
                    assertThat(e.getMessage()).isEqualTo("failed to validate receiver \"ops\" of type \"webhook\": "
                            + "required field 'url' is not specified");
                });
    }

    @Test
    void shouldLetCustomFactoryOverrideBuiltin() {
        List<NotifierFactory> factories = new ArrayList<>(BuiltinNotifierFactories.all());
        factories.add(NotifierFactory.of("webhook", (m, s, d, deps) -> StubNotifier.ok(m)));

        Integration integration = registry(factories).register(meta("ops", "webhook"), TestAlerts.json("{}"), DecryptFunction.plain());

        assertThat(integration.getNotifier()).isInstanceOf(StubNotifier.class);
    }
}
