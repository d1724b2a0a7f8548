package com.fastalert.core.notify;

import com.fastalert.core.spi.notify.ReceiverInfo;
import com.fastalert.core.template.TemplateExpander;
import com.fastalert.model.Alert;
import com.fastalert.model.AlertGroup;
import com.fastalert.model.ctx.NotifyContext;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;

/**
 * Notifier 公共步骤
 */
@Slf4j
public final class NotifySupport {

    public static final String COLOR_FIRING = "#D63232";
    public static final String COLOR_RESOLVED = "#36a64f";

    public static final String FOOTER_ICON_URL = "https://grafana.com/static/assets/img/fav32.png";

    private NotifySupport() {}

    public static String statusColor(AlertGroup group) {
        return group.isResolved() ? COLOR_RESOLVED : COLOR_FIRING;
    }

    /**
     * 告警状态, 触发为 alerting 恢复为 ok
     */
    public static String state(AlertGroup group) {
        return group.isResolved() ? "ok" : "alerting";
    }

    public static AlertGroup group(NotifyContext ctx, List<Alert> alerts, Clock clock) {
        return AlertGroup.of(ctx.getGroupKey(), alerts, clock.instant());
    }

    /**
     * 所有字段渲染完成后调用, 只输出第一个错误
     */
    public static void warnTemplateErrors(ReceiverInfo receiver, TemplateExpander tmpl) {
        if (tmpl.hasErrors()) {
            log.warn("[Notify-{}] receiver={} failed to render {} template field(s), first error: {}",
                    receiver.type(), receiver.name(), tmpl.errors().size(), tmpl.firstError().getMessage());
        }
    }
}
