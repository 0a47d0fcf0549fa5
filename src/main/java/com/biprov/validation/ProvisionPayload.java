package com.biprov.validation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.Map;

/**
 * Wire form of the inbound provisioning event, before validation.
 *
 * Constraint annotations mirror the accepted payload contract; {@link PayloadValidator} turns a
 * valid instance into an immutable {@link com.biprov.domain.ProvisionRequest}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProvisionPayload {

    public static final String PROJECT_ID_PATTERN = "^[a-z][a-z0-9-]{4,61}[a-z0-9]$";
    public static final String GROUP_EMAIL_PATTERN = "^[^@\\s]+@[^@\\s]+$";
    public static final String TOKEN_KEY_PATTERN = "^[A-Za-z0-9_]+$";

    @JsonProperty("projectId")
    @NotBlank(message = "is required")
    @Pattern(regexp = PROJECT_ID_PATTERN,
             message = "must start with a lowercase letter, contain only lowercase letters, digits "
                 + "or hyphens, be 6-63 characters long and end with a letter or digit")
    private String projectId;

    @JsonProperty("groupEmail")
    @NotBlank(message = "is required")
    @Pattern(regexp = GROUP_EMAIL_PATTERN,
             message = "must contain exactly one '@' with non-empty local and domain parts")
    private String groupEmail;

    @JsonProperty("ancestryPath")
    private String ancestryPath;

    @JsonProperty("templateDashboardIds")
    @Size(min = 1, message = "must not be empty when present")
    private List<@NotNull(message = "must not contain null") @Positive(message = "must be positive") Long> templateDashboardIds;

    @JsonProperty("templateFolderId")
    @Positive(message = "must be positive")
    private Long templateFolderId;

    @JsonProperty("tokens")
    private Map<@Pattern(regexp = TOKEN_KEY_PATTERN, message = "key must match [A-Za-z0-9_]+") String,
        @NotNull(message = "value must not be null") String> tokens;

    public String getProjectId() {
        return projectId;
    }

    public void setProjectId(String projectId) {
        this.projectId = projectId;
    }

    public String getGroupEmail() {
        return groupEmail;
    }

    public void setGroupEmail(String groupEmail) {
        this.groupEmail = groupEmail;
    }

    public String getAncestryPath() {
        return ancestryPath;
    }

    public void setAncestryPath(String ancestryPath) {
        this.ancestryPath = ancestryPath;
    }

    public List<Long> getTemplateDashboardIds() {
        return templateDashboardIds;
    }

    public void setTemplateDashboardIds(List<Long> templateDashboardIds) {
        this.templateDashboardIds = templateDashboardIds;
    }

    public Long getTemplateFolderId() {
        return templateFolderId;
    }

    public void setTemplateFolderId(Long templateFolderId) {
        this.templateFolderId = templateFolderId;
    }

    public Map<String, String> getTokens() {
        return tokens;
    }

    public void setTokens(Map<String, String> tokens) {
        this.tokens = tokens;
    }
}
