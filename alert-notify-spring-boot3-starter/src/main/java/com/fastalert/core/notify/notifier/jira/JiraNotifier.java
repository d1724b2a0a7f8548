package com.fastalert.core.notify.notifier.jira;

import com.fastalert.core.notify.NotifierDependencies;
import com.fastalert.core.notify.NotifySupport;
import com.fastalert.core.notify.ResponseChecks;
import com.fastalert.core.notify.WebhookSender;
import com.fastalert.core.receiver.ReceiverMetadata;
import com.fastalert.core.spi.PayloadSerializer;
import com.fastalert.core.spi.notify.Notifier;
import com.fastalert.core.spi.transport.WebhookRequest;
import com.fastalert.core.spi.transport.WebhookResponse;
import com.fastalert.core.template.DefaultTemplates;
import com.fastalert.core.template.TemplateExpander;
import com.fastalert.core.template.TemplateRenderer;
import com.fastalert.core.template.Truncations;
import com.fastalert.core.util.UrlPaths;
import com.fastalert.exception.NotifyException;
import com.fastalert.model.Alert;
import com.fastalert.model.AlertGroup;
import com.fastalert.model.ctx.NotifyContext;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * JIRA 工单通知
 * 先按分组哈希查询已有工单, 再创建或更新, 必要时执行重新打开/解决流转
 * api_url 以 /3 结尾时使用 v3 API, 描述按 Atlassian 文档格式发送
 */
@Slf4j
public class JiraNotifier implements Notifier {

    public static final String TYPE = "jira";

    public static final int MAX_SUMMARY_LEN_RUNES = 255;
    public static final int MAX_DESCRIPTION_LEN_RUNES = 32767;

    static final String DONE_CATEGORY = "done";

    private static final TypeReference<JiraIssue.SearchResult> SEARCH_RESULT = new TypeReference<>() {};
    private static final TypeReference<JiraIssue.Transitions> TRANSITIONS = new TypeReference<>() {};

    private final ReceiverMetadata meta;

    private final JiraConfig conf;

    private final TemplateRenderer renderer;

    private final PayloadSerializer serializer;

    private final WebhookSender sender;

    private final Clock clock;

    // 429 与 5xx 可重试, 其余 4xx 为永久失败
    private final ResponseChecks checks = ResponseChecks.retryOn(429);

    public JiraNotifier(ReceiverMetadata meta, JiraConfig conf, NotifierDependencies deps) {
        this.meta = meta;
        this.conf = conf;
        this.renderer = deps.getRenderer();
        this.serializer = deps.getSerializer();
        this.sender = deps.webhookSender();
        this.clock = deps.getClock();
    }

    @Override
    public void notify(NotifyContext ctx, List<Alert> alerts) throws NotifyException {
        AlertGroup group = NotifySupport.group(ctx, alerts, clock);
        String hash = ctx.getGroupKey().hash();
        boolean firing = !group.isResolved();
        log.debug("[Notify-jira] receiver={} group={} executing", name(), hash);

        JiraIssue existing = searchExistingIssue(hash, firing);

        String method;
        String path;
        if (existing == null) {
            // 已恢复的分组不新建工单
            if (!firing) {
                log.debug("[Notify-jira] receiver={} group={} resolved and no issue found", name(), hash);
                return;
            }
            method = "POST";
            path = "issue";
        } else {
            method = "PUT";
            path = "issue/" + existing.getKey();
            log.debug("[Notify-jira] receiver={} updating issue {}", name(), existing.getKey());
        }

        TemplateExpander tmpl = renderer.newExpander(ctx, group);
        ObjectNode issue = prepareIssue(tmpl, hash);
        NotifySupport.warnTemplateErrors(this, tmpl);

        doApiRequest(method, path, issue);

        if (existing != null) {
            transitionIssue(existing, firing);
        }
    }

    ObjectNode prepareIssue(TemplateExpander tmpl, String hash) {
        ObjectNode fields = serializer.createObjectNode();
        conf.getFields().forEach((k, v) -> fields.set(k, v.isTextual() ? fields.textNode(tmpl.expand(v.asText())) : v.deepCopy()));

        Truncations.Truncated summary = Truncations.inRunes(
                tmpl.expandOrDefault(conf.getSummary(), DefaultTemplates.JIRA_SUMMARY), MAX_SUMMARY_LEN_RUNES);
        if (summary.truncated()) {
            log.warn("[Notify-jira] receiver={} truncated summary, max_runes={}", name(), MAX_SUMMARY_LEN_RUNES);
        }
        fields.put("summary", summary.value());

        String description = tmpl.expandOrDefault(conf.getDescription(), DefaultTemplates.JIRA_DESCRIPTION);
        fields.set("description", prepareDescription(description));

        String project = tmpl.expand(conf.getProject()).trim();
        if (!project.isEmpty()) {
            fields.putObject("project").put("key", project);
        }
        String issueType = tmpl.expand(conf.getIssueType()).trim();
        if (!issueType.isEmpty()) {
            fields.putObject("issuetype").put("name", issueType);
        }
        String priority = tmpl.expand(conf.getPriority()).trim();
        if (!priority.isEmpty()) {
            fields.putObject("priority").put("name", priority);
        }

        List<String> labels = new ArrayList<>();
        for (String label : conf.getLabels()) {
            String rendered = tmpl.expand(label).trim();
            if (!rendered.isEmpty()) {
                labels.add(rendered);
            }
        }
        if (conf.hasDedupKeyField()) {
            fields.put("customfield_" + conf.getDedupKeyFieldName(), hash);
        } else {
            labels.add(alertLabel(hash));
        }
        Collections.sort(labels);
        ArrayNode labelsNode = fields.putArray("labels");
        labels.forEach(labelsNode::add);

        ObjectNode issue = serializer.createObjectNode();
        issue.set("fields", fields);
        return issue;
    }

    /**
     * v2 为纯文本, v3 为 JSON 文档; 不是合法 JSON 时包装为单段落文档
     */
    JsonNode prepareDescription(String description) {
        if (!conf.isV3()) {
            Truncations.Truncated t = Truncations.inRunes(description, MAX_DESCRIPTION_LEN_RUNES);
            if (t.truncated()) {
                log.warn("[Notify-jira] receiver={} truncated description, max_runes={}", name(), MAX_DESCRIPTION_LEN_RUNES);
            }
            return serializer.valueToTree(t.value());
        }
        String trimmed = description.trim();
        if (trimmed.startsWith("{")) {
            try {
                JsonNode parsed = serializer.readTree(trimmed.getBytes(StandardCharsets.UTF_8));
                if (parsed.isObject()) {
                    return parsed;
                }
            } catch (IllegalStateException e) {
                log.debug("[Notify-jira] receiver={} description is not a JSON document, wrapping as text", name());
            }
        }
        int overhead = adfDocument("").toString().length();
        return adfDocument(Truncations.inRunes(description, MAX_DESCRIPTION_LEN_RUNES - overhead).value());
    }

    ObjectNode adfDocument(String text) {
        ObjectNode doc = serializer.createObjectNode();
        doc.put("version", 1);
        doc.put("type", "doc");
        ObjectNode paragraph = doc.putArray("content").addObject();
        paragraph.put("type", "paragraph");
        ObjectNode textNode = paragraph.putArray("content").addObject();
        textNode.put("type", "text");
        textNode.put("text", text);
        return doc;
    }

    /**
     * 未找到返回 null; 多于一条时取最近解决的一条
     */
    JiraIssue searchExistingIssue(String hash, boolean firing) throws NotifyException {
        ObjectNode body = serializer.createObjectNode();
        body.put("jql", searchJql(hash, firing));
        body.put("maxResults", 2);
        body.putArray("fields").add("status");
        body.putArray("expand");
        log.debug("[Notify-jira] receiver={} search jql={}", name(), body.get("jql").asText());

        String path = conf.isV3() ? "search/jql" : "search";
        WebhookResponse resp;
        try {
            resp = doApiRequest("POST", path, body);
        } catch (NotifyException e) {
            throw new NotifyException("failed to look up existing issues: " + e.getMessage(), e.isRetryable(), e);
        }
        JiraIssue.SearchResult result;
        try {
            result = serializer.deserialize(resp.body(), SEARCH_RESULT);
        } catch (IllegalStateException e) {
            throw NotifyException.permanent("failed to look up existing issues: unexpected search response", e);
        }
        if (result == null || result.getIssues() == null || result.getIssues().isEmpty()) {
            log.debug("[Notify-jira] receiver={} found no existing issue", name());
            return null;
        }
        JiraIssue first = result.getIssues().get(0);
        if (result.getIssues().size() > 1 || result.getTotal() > 1) {
            log.warn("[Notify-jira] receiver={} more than one issue matched, selecting the most recently resolved: {}", name(), first.getKey());
        }
        return first;
    }

    String searchJql(String hash, boolean firing) {
        StringBuilder jql = new StringBuilder();
        if (!conf.getWontFixResolution().isEmpty()) {
            jql.append("resolution != ").append(quote(conf.getWontFixResolution())).append(" and ");
        }
        if (firing) {
            // 没有重新打开流转时不查已完成的工单
            if (conf.getReopenTransition().isEmpty()) {
                jql.append("statusCategory != Done and ");
            }
        } else {
            long minutes = conf.getReopenDuration().toMinutes();
            if (minutes != 0) {
                jql.append("(resolutiondate is EMPTY OR resolutiondate >= -").append(minutes).append("m) and ");
            }
        }
        String labelClause = "labels = " + quote(alertLabel(hash));
        if (conf.hasDedupKeyField()) {
            jql.append('(').append(labelClause).append(" or cf[").append(conf.getDedupKeyFieldName()).append("] ~ ")
                    .append(quote(hash)).append(')');
        } else {
            jql.append(labelClause);
        }
        jql.append(" and project=").append(quote(conf.getProject()))
                .append(" order by status ASC,resolutiondate DESC");
        return jql.toString();
    }

    void transitionIssue(JiraIssue issue, boolean firing) throws NotifyException {
        String category = issue.statusCategory();
        if (issue.getKey() == null || category == null) {
            return;
        }
        String transition;
        if (firing) {
            if (!DONE_CATEGORY.equals(category)) {
                return;
            }
            transition = conf.getReopenTransition();
        } else {
            if (DONE_CATEGORY.equals(category)) {
                return;
            }
            transition = conf.getResolveTransition();
        }
        if (transition.isEmpty()) {
            return;
        }

        String transitionId = transitionIdByName(issue.getKey(), transition);
        ObjectNode body = serializer.createObjectNode();
        body.putObject("transition").put("id", transitionId);
        log.debug("[Notify-jira] receiver={} transition issue {} with {}", name(), issue.getKey(), transition);
        doApiRequest("POST", "issue/" + issue.getKey() + "/transitions", body);
    }

    private String transitionIdByName(String issueKey, String transitionName) throws NotifyException {
        WebhookResponse resp = doApiRequest("GET", "issue/" + issueKey + "/transitions", null);
        JiraIssue.Transitions transitions;
        try {
            transitions = serializer.deserialize(resp.body(), TRANSITIONS);
        } catch (IllegalStateException e) {
            throw NotifyException.permanent("unexpected transitions response for issue " + issueKey, e);
        }
        if (transitions != null && transitions.getTransitions() != null) {
            for (JiraIssue.Transition t : transitions.getTransitions()) {
                if (transitionName.equals(t.getName())) {
                    return t.getId();
                }
            }
        }
        throw NotifyException.permanent(String.format("can't find transition %s for issue %s", transitionName, issueKey));
    }

    private WebhookResponse doApiRequest(String method, String path, JsonNode body) throws NotifyException {
        WebhookRequest.WebhookRequestBuilder req = WebhookRequest.builder()
                .url(UrlPaths.join(conf.getUrl().toString(), path))
                .method(method)
                .header("Content-Type", "application/json")
                .header("Accept-Language", "en");
        if (body != null) {
            req.body(serializer.serialize(body));
        }
        if (!conf.getToken().isEmpty()) {
            req.bearerToken(conf.getToken());
        } else {
            req.user(conf.getUser()).password(conf.getPassword());
        }
        try {
            return sender.send(req.build(), checks);
        } catch (NotifyException e) {
            throw new NotifyException(String.format("failed to %s request to \"%s\": %s", method, path, e.getMessage()),
                    e.isRetryable(), e);
        }
    }

    static String alertLabel(String hash) {
        return "ALERT{" + hash + "}";
    }

    private static String quote(String s) {
        return '"' + s.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }

    @Override
    public String name() {
        return meta.name();
    }

    @Override
    public String type() {
        return meta.type();
    }

    @Override
    public boolean disableResolve() {
        return meta.disableResolve();
    }
}
