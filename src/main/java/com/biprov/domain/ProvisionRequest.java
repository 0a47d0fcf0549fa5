package com.biprov.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Validated, immutable input for one provisioning invocation.
 *
 * Instances are produced by {@link com.biprov.validation.PayloadValidator} from the raw event
 * bytes and never change afterwards. Template dashboard ids keep their input order because the
 * resulting dashboard ids are reported index-aligned with them.
 */
public final class ProvisionRequest {

    private final String projectId;
    private final String groupEmail;
    private final String ancestryPath;
    private final List<Long> templateDashboardIds;
    private final Long templateFolderId;
    private final Map<String, String> tokens;

    private ProvisionRequest(Builder builder) {
        this.projectId = Objects.requireNonNull(builder.projectId, "projectId");
        this.groupEmail = Objects.requireNonNull(builder.groupEmail, "groupEmail");
        this.ancestryPath = builder.ancestryPath;
        this.templateDashboardIds = builder.templateDashboardIds == null
            ? Collections.emptyList()
            : List.copyOf(builder.templateDashboardIds);
        this.templateFolderId = builder.templateFolderId;
        this.tokens = builder.tokens == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(builder.tokens));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Copy of this request with a different dashboard template list. Used when the caller
     * omitted the list and the configured defaults apply.
     */
    public ProvisionRequest withTemplateDashboardIds(List<Long> ids) {
        return toBuilder().templateDashboardIds(ids).build();
    }

    public Builder toBuilder() {
        return new Builder()
            .projectId(projectId)
            .groupEmail(groupEmail)
            .ancestryPath(ancestryPath)
            .templateDashboardIds(templateDashboardIds)
            .templateFolderId(templateFolderId)
            .tokens(tokens);
    }

    public String getProjectId() {
        return projectId;
    }

    public String getGroupEmail() {
        return groupEmail;
    }

    public String getAncestryPath() {
        return ancestryPath;
    }

    public List<Long> getTemplateDashboardIds() {
        return templateDashboardIds;
    }

    public Long getTemplateFolderId() {
        return templateFolderId;
    }

    public Map<String, String> getTokens() {
        return tokens;
    }

    /**
     * Deterministic name of the project folder on the BI platform.
     */
    public String folderName() {
        return "Project: " + projectId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ProvisionRequest)) {
            return false;
        }
        ProvisionRequest that = (ProvisionRequest) o;
        return projectId.equals(that.projectId)
            && groupEmail.equals(that.groupEmail)
            && Objects.equals(ancestryPath, that.ancestryPath)
            && templateDashboardIds.equals(that.templateDashboardIds)
            && Objects.equals(templateFolderId, that.templateFolderId)
            && tokens.equals(that.tokens);
    }

    @Override
    public int hashCode() {
        return Objects.hash(projectId, groupEmail, ancestryPath, templateDashboardIds, templateFolderId, tokens);
    }

    @Override
    public String toString() {
        return "ProvisionRequest{projectId='" + projectId + "', groupEmail='" + groupEmail
            + "', templateDashboardIds=" + templateDashboardIds + "}";
    }

    public static class Builder {
        private String projectId;
        private String groupEmail;
        private String ancestryPath;
        private List<Long> templateDashboardIds;
        private Long templateFolderId;
        private Map<String, String> tokens;

        public Builder projectId(String projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder groupEmail(String groupEmail) {
            this.groupEmail = groupEmail;
            return this;
        }

        public Builder ancestryPath(String ancestryPath) {
            this.ancestryPath = ancestryPath;
            return this;
        }

        public Builder templateDashboardIds(List<Long> templateDashboardIds) {
            this.templateDashboardIds = templateDashboardIds;
            return this;
        }

        public Builder templateFolderId(Long templateFolderId) {
            this.templateFolderId = templateFolderId;
            return this;
        }

        public Builder tokens(Map<String, String> tokens) {
            this.tokens = tokens;
            return this;
        }

        public ProvisionRequest build() {
            return new ProvisionRequest(this);
        }
    }
}
