package com.fastalert.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * fast-alert:
 *   external-url: https://grafana.example.com/
 *   templates:
 *     my.title: "[{{ status }}] {{ commonLabels['alertname'] }}"
 *   receivers:
 *     - name: ops-slack
 *       type: slack
 *       settings: { recipient: "#ops", mentionChannel: here }
 *       secure-settings: { token: xoxb-... }
 */
@ConfigurationProperties(prefix = "fast-alert")
public class AlertNotifyProperties {

    /** 告警系统外部访问地址, 用于拼接规则与静默链接 */
    private String externalUrl = "";

    /** 出站 User-Agent 与消息中的版本号 */
    private String appVersion = "1.0.0";

    /** 用户命名模板, 与内置模板同名时覆盖 */
    private Map<String, String> templates = new LinkedHashMap<>();

    private List<Receiver> receivers = new ArrayList<>();

    private Dispatch dispatch = new Dispatch();

    private Http http = new Http();

    private Mail mail = new Mail();

    public String getExternalUrl() {
        return externalUrl;
    }

    public void setExternalUrl(String externalUrl) {
        this.externalUrl = externalUrl;
    }

    public String getAppVersion() {
        return appVersion;
    }

    public void setAppVersion(String appVersion) {
        this.appVersion = appVersion;
    }

    public Map<String, String> getTemplates() {
        return templates;
    }

    public void setTemplates(Map<String, String> templates) {
        this.templates = templates;
    }

    public List<Receiver> getReceivers() {
        return receivers;
    }

    public void setReceivers(List<Receiver> receivers) {
        this.receivers = receivers;
    }

    public Dispatch getDispatch() {
        return dispatch;
    }

    public void setDispatch(Dispatch dispatch) {
        this.dispatch = dispatch;
    }

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public Mail getMail() {
        return mail;
    }

    public void setMail(Mail mail) {
        this.mail = mail;
    }

    public static class Receiver {
        private String uid;

        private String name;

        private String type;

        private boolean disableResolveMessage = false;

        /** 明文配置, 结构与各接收器的 JSON 配置一致 */
        private Map<String, Object> settings = new LinkedHashMap<>();

        /** 敏感配置, 优先于 settings 中的同名字段 */
        private Map<String, String> secureSettings = new LinkedHashMap<>();

        public String getUid() {
            return uid;
        }

        public void setUid(String uid) {
            this.uid = uid;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public boolean isDisableResolveMessage() {
            return disableResolveMessage;
        }

        public void setDisableResolveMessage(boolean disableResolveMessage) {
            this.disableResolveMessage = disableResolveMessage;
        }

        public Map<String, Object> getSettings() {
            return settings;
        }

        public void setSettings(Map<String, Object> settings) {
            this.settings = settings;
        }

        public Map<String, String> getSecureSettings() {
            return secureSettings;
        }

        public void setSecureSettings(Map<String, String> secureSettings) {
            this.secureSettings = secureSettings;
        }
    }

    public static class Dispatch {
        private int corePoolSize = 4;

        private int maxPoolSize = 8;

        private int queueCapacity = 2000;

        private Duration keepAlive = Duration.ofSeconds(60);

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public Duration getKeepAlive() {
            return keepAlive;
        }

        public void setKeepAlive(Duration keepAlive) {
            this.keepAlive = keepAlive;
        }
    }

    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(10);

        private Duration readTimeout = Duration.ofSeconds(30);

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }
    }

    public static class Mail {
        private String from = "alerting@localhost";

        public String getFrom() {
            return from;
        }

        public void setFrom(String from) {
            this.from = from;
        }
    }
}
