package com.biprov.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One line of the created-versus-reused report attached to a {@link ProvisionResult}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ProvisionedResource {

    @JsonProperty("kind")
    private final ResourceKind kind;

    @JsonProperty("id")
    private final long id;

    @JsonProperty("action")
    private final ResourceAction action;

    @JsonProperty("templateId")
    private final Long templateId;

    /**
     * Set on dashboards whose title and description could not be written yet. The next run
     * finds them under the template title and finishes them.
     */
    @JsonProperty("textPending")
    private final Boolean textPending;

    public ProvisionedResource(ResourceKind kind, long id, ResourceAction action, Long templateId) {
        this(kind, id, action, templateId, false);
    }

    public ProvisionedResource(ResourceKind kind, long id, ResourceAction action, Long templateId,
                               boolean textPending) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.id = id;
        this.action = Objects.requireNonNull(action, "action");
        this.templateId = templateId;
        this.textPending = textPending ? Boolean.TRUE : null;
    }

    public static ProvisionedResource of(ResourceKind kind, long id, ResourceAction action) {
        return new ProvisionedResource(kind, id, action, null);
    }

    public ResourceKind getKind() {
        return kind;
    }

    public long getId() {
        return id;
    }

    public ResourceAction getAction() {
        return action;
    }

    public Long getTemplateId() {
        return templateId;
    }

    @JsonIgnore
    public boolean isTextPending() {
        return Boolean.TRUE.equals(textPending);
    }

    @JsonIgnore
    public boolean isCreated() {
        return action == ResourceAction.CREATED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ProvisionedResource)) {
            return false;
        }
        ProvisionedResource that = (ProvisionedResource) o;
        return id == that.id && kind == that.kind && action == that.action
            && Objects.equals(templateId, that.templateId)
            && Objects.equals(textPending, that.textPending);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, id, action, templateId, textPending);
    }

    @Override
    public String toString() {
        return kind + "#" + id + " " + action + (templateId != null ? " (template " + templateId + ")" : "")
            + (isTextPending() ? " text pending" : "");
    }
}
