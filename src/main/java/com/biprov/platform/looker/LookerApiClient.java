package com.biprov.platform.looker;

import com.biprov.domain.AccessConfig;
import com.biprov.domain.AccessMapping;
import com.biprov.domain.DashboardClone;
import com.biprov.domain.DashboardTemplate;
import com.biprov.domain.RemoteFolder;
import com.biprov.domain.RemoteGroup;
import com.biprov.domain.ScheduledPlan;
import com.biprov.platform.BiPlatformClient;
import com.biprov.platform.PlatformException;
import com.biprov.platform.TitleMatcher;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * {@link BiPlatformClient} backed by the Looker REST API (4.0).
 *
 * Every call is blocking, bounded by the configured request timeout, and made exactly once:
 * errors are translated into {@link PlatformException} and never retried here. Looker ids are
 * numeric strings on the wire and longs in the domain model.
 *
 * Search endpoints on Looker match case-insensitively, so results are filtered again locally
 * for exact name and parent matches.
 */
public class LookerApiClient implements BiPlatformClient {

    private static final Logger log = LoggerFactory.getLogger(LookerApiClient.class);

    private static final Set<String> MAPPING_FIELDS = Set.of("name", "looker_group_id", "looker_group_name");

    private final WebClient webClient;
    private final LookerAuthenticator authenticator;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;
    private final long rootFolderId;

    public LookerApiClient(
        WebClient webClient,
        LookerAuthenticator authenticator,
        ObjectMapper objectMapper,
        Duration requestTimeout,
        long rootFolderId
    ) {
        this.webClient = webClient;
        this.authenticator = authenticator;
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
        this.rootFolderId = rootFolderId;
    }

    // Groups

    @Override
    public List<RemoteGroup> findGroupByName(String name) {
        JsonNode body = call("findGroupByName", () -> webClient.get()
            .uri(b -> b.path("/groups/search").queryParam("name", "{name}").queryParam("fields", "id,name").build(name))
            .headers(h -> h.setBearerAuth(authenticator.token()))
            .retrieve()
            .bodyToMono(JsonNode.class));

        List<RemoteGroup> groups = new ArrayList<>();
        for (JsonNode node : array("findGroupByName", body)) {
            RemoteGroup group = toGroup("findGroupByName", node);
            if (name.equals(group.getName())) {
                groups.add(group);
            }
        }
        return groups;
    }

    @Override
    public RemoteGroup createGroup(String name) {
        ObjectNode request = objectMapper.createObjectNode().put("name", name);
        JsonNode body = call("createGroup", () -> webClient.post()
            .uri("/groups")
            .headers(h -> h.setBearerAuth(authenticator.token()))
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(request)
            .retrieve()
            .bodyToMono(JsonNode.class));
        RemoteGroup group = toGroup("createGroup", required("createGroup", body));
        log.debug("Looker created group {}", group);
        return group;
    }

    // Access configuration (SAML group bindings)

    @Override
    public AccessConfig getAccessConfig() {
        JsonNode body = call("getAccessConfig", () -> webClient.get()
            .uri("/saml_config")
            .headers(h -> h.setBearerAuth(authenticator.token()))
            .retrieve()
            .bodyToMono(JsonNode.class));
        return toAccessConfig("getAccessConfig", required("getAccessConfig", body));
    }

    @Override
    public boolean groupIsMappedInAccessConfig(AccessConfig config, long groupId) {
        return config.containsGroup(groupId);
    }

    @Override
    public AccessConfig appendGroupToAccessConfig(AccessConfig config, RemoteGroup group) {
        AccessConfig merged = config.merge(AccessMapping.forGroup(group));

        ArrayNode groups = objectMapper.createArrayNode();
        for (AccessMapping mapping : merged.getMappings()) {
            groups.add(toJson(mapping));
        }
        ObjectNode request = objectMapper.createObjectNode();
        request.set("groups", groups);

        JsonNode body = call("appendGroupToAccessConfig", () -> webClient.patch()
            .uri("/saml_config")
            .headers(h -> h.setBearerAuth(authenticator.token()))
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(request)
            .retrieve()
            .bodyToMono(JsonNode.class));

        AccessConfig stored = toAccessConfig("appendGroupToAccessConfig", required("appendGroupToAccessConfig", body));
        if (!stored.containsAll(merged)) {
            throw new PlatformException("appendGroupToAccessConfig",
                "stored access configuration is missing entries: expected " + merged.size()
                    + " mapping(s), platform returned " + stored.size());
        }
        return stored;
    }

    // Folders

    @Override
    public List<RemoteFolder> findFolderByName(String name, Long parentId) {
        long parent = effectiveParent(parentId);
        JsonNode body = call("findFolderByName", () -> webClient.get()
            .uri(b -> b.path("/folders/search")
                .queryParam("name", "{name}")
                .queryParam("parent_id", parent)
                .queryParam("fields", "id,name,parent_id")
                .build(name))
            .headers(h -> h.setBearerAuth(authenticator.token()))
            .retrieve()
            .bodyToMono(JsonNode.class));

        List<RemoteFolder> folders = new ArrayList<>();
        for (JsonNode node : array("findFolderByName", body)) {
            RemoteFolder folder = toFolder("findFolderByName", node);
            if (name.equals(folder.getName()) && Objects.equals(folder.getParentId(), parent)) {
                folders.add(folder);
            }
        }
        return folders;
    }

    @Override
    public RemoteFolder createFolder(String name, Long parentId) {
        ObjectNode request = objectMapper.createObjectNode()
            .put("name", name)
            .put("parent_id", String.valueOf(effectiveParent(parentId)));
        JsonNode body = call("createFolder", () -> webClient.post()
            .uri("/folders")
            .headers(h -> h.setBearerAuth(authenticator.token()))
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(request)
            .retrieve()
            .bodyToMono(JsonNode.class));
        return toFolder("createFolder", required("createFolder", body));
    }

    @Override
    public RemoteFolder renameFolder(long folderId, String newName) {
        ObjectNode request = objectMapper.createObjectNode().put("name", newName);
        JsonNode body = call("renameFolder", () -> webClient.patch()
            .uri("/folders/{id}", folderId)
            .headers(h -> h.setBearerAuth(authenticator.token()))
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(request)
            .retrieve()
            .bodyToMono(JsonNode.class));
        return toFolder("renameFolder", required("renameFolder", body));
    }

    // Dashboards

    @Override
    public DashboardTemplate getDashboardTemplate(long templateId) {
        JsonNode body = call("getDashboardTemplate", () -> webClient.get()
            .uri(b -> b.path("/dashboards/{id}").queryParam("fields", "id,title,description").build(templateId))
            .headers(h -> h.setBearerAuth(authenticator.token()))
            .retrieve()
            .bodyToMono(JsonNode.class));
        JsonNode node = required("getDashboardTemplate", body);
        return new DashboardTemplate(templateId, text(node, "title"), text(node, "description"));
    }

    @Override
    public Optional<DashboardClone> findDashboardByTitle(String title, long folderId) {
        JsonNode body = call("findDashboardByTitle", () -> webClient.get()
            .uri(b -> b.path("/dashboards/search")
                .queryParam("title", "{title}")
                .queryParam("folder_id", folderId)
                .queryParam("deleted", false)
                .queryParam("fields", "id,title,description,folder_id")
                .build(title))
            .headers(h -> h.setBearerAuth(authenticator.token()))
            .retrieve()
            .bodyToMono(JsonNode.class));

        for (JsonNode node : array("findDashboardByTitle", body)) {
            DashboardClone dashboard = toDashboard("findDashboardByTitle", node, folderId);
            if (dashboard.getFolderId() == folderId && TitleMatcher.matches(dashboard.getTitle(), title)) {
                return Optional.of(dashboard);
            }
        }
        return Optional.empty();
    }

    /**
     * Copies the template into the folder. Looker's copy endpoint does not take a title, so a
     * title other than the one the copy came out with costs a second call.
     */
    @Override
    public DashboardClone cloneDashboard(long templateId, long folderId, String title) {
        JsonNode copied = call("cloneDashboard", () -> webClient.post()
            .uri(b -> b.path("/dashboards/{id}/copy").queryParam("folder_id", folderId).build(templateId))
            .headers(h -> h.setBearerAuth(authenticator.token()))
            .retrieve()
            .bodyToMono(JsonNode.class));
        DashboardClone copy = toDashboard("cloneDashboard", required("cloneDashboard", copied), folderId);
        if (title == null || title.equals(copy.getTitle())) {
            return copy;
        }

        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("title", title);
        JsonNode renamed = patchDashboard("cloneDashboard", copy.getId(), fields);
        return toDashboard("cloneDashboard", renamed, folderId);
    }

    @Override
    public void updateDashboardText(long dashboardId, Map<String, String> resolvedFields) {
        if (resolvedFields.isEmpty()) {
            return;
        }
        patchDashboard("updateDashboardText", dashboardId, resolvedFields);
    }

    @Override
    public List<DashboardClone> findDashboardsInFolder(long folderId) {
        JsonNode body = call("findDashboardsInFolder", () -> webClient.get()
            .uri(b -> b.path("/folders/{id}/dashboards").queryParam("fields", "id,title,description,folder_id").build(folderId))
            .headers(h -> h.setBearerAuth(authenticator.token()))
            .retrieve()
            .bodyToMono(JsonNode.class));

        List<DashboardClone> dashboards = new ArrayList<>();
        for (JsonNode node : array("findDashboardsInFolder", body)) {
            dashboards.add(toDashboard("findDashboardsInFolder", node, folderId));
        }
        return dashboards;
    }

    @Override
    public void deleteDashboard(long dashboardId) {
        call("deleteDashboard", () -> webClient.delete()
            .uri("/dashboards/{id}", dashboardId)
            .headers(h -> h.setBearerAuth(authenticator.token()))
            .retrieve()
            .toBodilessEntity());
    }

    // Scheduled plans

    @Override
    public List<ScheduledPlan> findScheduledPlansForDashboard(long dashboardId) {
        JsonNode body = call("findScheduledPlansForDashboard", () -> webClient.get()
            .uri(b -> b.path("/scheduled_plans/dashboard/{id}")
                .queryParam("all_users", true)
                .queryParam("fields", "id,name,dashboard_id")
                .build(dashboardId))
            .headers(h -> h.setBearerAuth(authenticator.token()))
            .retrieve()
            .bodyToMono(JsonNode.class));

        List<ScheduledPlan> plans = new ArrayList<>();
        for (JsonNode node : array("findScheduledPlansForDashboard", body)) {
            long owner = node.hasNonNull("dashboard_id")
                ? id("findScheduledPlansForDashboard", node, "dashboard_id")
                : dashboardId;
            plans.add(new ScheduledPlan(id("findScheduledPlansForDashboard", node, "id"), text(node, "name"), owner));
        }
        return plans;
    }

    @Override
    public void deleteScheduledPlan(long planId) {
        call("deleteScheduledPlan", () -> webClient.delete()
            .uri("/scheduled_plans/{id}", planId)
            .headers(h -> h.setBearerAuth(authenticator.token()))
            .retrieve()
            .toBodilessEntity());
    }

    private JsonNode patchDashboard(String operation, long dashboardId, Map<String, String> fields) {
        ObjectNode request = objectMapper.createObjectNode();
        fields.forEach(request::put);
        JsonNode body = call(operation, () -> webClient.patch()
            .uri("/dashboards/{id}", dashboardId)
            .headers(h -> h.setBearerAuth(authenticator.token()))
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(request)
            .retrieve()
            .bodyToMono(JsonNode.class));
        return required(operation, body);
    }

    /**
     * Runs one request, translating every failure into a {@link PlatformException}.
     */
    private <T> T call(String operation, Supplier<Mono<T>> request) {
        try {
            return request.get().timeout(requestTimeout).block();
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            if (status == 401) {
                authenticator.invalidate();
            }
            log.warn("Looker {} returned HTTP {}: {}", operation, status, e.getResponseBodyAsString());
            throw new PlatformException(operation, "Looker " + operation + " returned HTTP " + status, status, e);
        } catch (PlatformException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                throw new PlatformException(operation,
                    "Looker " + operation + " timed out after " + requestTimeout.toMillis() + "ms", e);
            }
            throw new PlatformException(operation, "Looker " + operation + " failed: " + cause.getMessage(), e);
        }
    }

    private long effectiveParent(Long parentId) {
        return parentId != null ? parentId : rootFolderId;
    }

    // Mapping

    private AccessConfig toAccessConfig(String operation, JsonNode node) {
        List<AccessMapping> mappings = new ArrayList<>();
        for (JsonNode entry : node.path("groups")) {
            Map<String, Object> attributes = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = entry.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!MAPPING_FIELDS.contains(field.getKey())) {
                    attributes.put(field.getKey(), objectMapper.convertValue(field.getValue(), Object.class));
                }
            }
            mappings.add(new AccessMapping(
                text(entry, "name"),
                id(operation, entry, "looker_group_id"),
                text(entry, "looker_group_name"),
                attributes));
        }
        return new AccessConfig(mappings);
    }

    private ObjectNode toJson(AccessMapping mapping) {
        ObjectNode node = objectMapper.createObjectNode();
        mapping.getAttributes().forEach((k, v) -> node.set(k, objectMapper.valueToTree(v)));
        node.put("name", mapping.getName());
        node.put("looker_group_id", String.valueOf(mapping.getGroupId()));
        node.put("looker_group_name", mapping.getGroupName());
        return node;
    }

    private RemoteGroup toGroup(String operation, JsonNode node) {
        return new RemoteGroup(id(operation, node, "id"), text(node, "name"));
    }

    private RemoteFolder toFolder(String operation, JsonNode node) {
        Long parent = node.hasNonNull("parent_id") ? id(operation, node, "parent_id") : null;
        return new RemoteFolder(id(operation, node, "id"), text(node, "name"), parent);
    }

    private DashboardClone toDashboard(String operation, JsonNode node, long defaultFolderId) {
        long folderId = node.hasNonNull("folder_id") ? id(operation, node, "folder_id") : defaultFolderId;
        return new DashboardClone(id(operation, node, "id"), text(node, "title"), folderId, text(node, "description"));
    }

    private static long id(String operation, JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new PlatformException(operation, "Looker response has no " + field);
        }
        try {
            return value.isNumber() ? value.asLong() : Long.parseLong(value.asText().trim());
        } catch (NumberFormatException e) {
            throw new PlatformException(operation, "Looker returned non-numeric " + field + " '" + value.asText() + "'", e);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static JsonNode required(String operation, JsonNode body) {
        if (body == null || body.isNull() || body.isMissingNode()) {
            throw new PlatformException(operation, "Looker " + operation + " returned an empty body");
        }
        return body;
    }

    private static JsonNode array(String operation, JsonNode body) {
        if (body == null || body.isNull()) {
            return MissingNode.getInstance();
        }
        if (!body.isArray()) {
            throw new PlatformException(operation, "Looker " + operation + " returned a non-array body");
        }
        return body;
    }
}
