package com.biprov.config;

import com.biprov.reconcile.GroupMatchPolicy;
import com.biprov.template.UnresolvedTokenPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings bound from {@code provisioner.*}.
 *
 * Every value can be overridden through the environment in Spring's relaxed form, for example
 * {@code PROVISIONER_LOOKER_CLIENT_SECRET}.
 */
@ConfigurationProperties(prefix = "provisioner")
public class ProvisionerProperties {

    public enum PlatformType {
        LOOKER,
        IN_MEMORY
    }

    private PlatformType platform = PlatformType.LOOKER;

    /**
     * Templates cloned when a payload does not list any.
     */
    private List<Long> defaultTemplateDashboardIds = new ArrayList<>();

    /**
     * Folder holding the templates. Informational; cloning addresses templates by id.
     */
    private Long defaultTemplateFolderId;

    /**
     * Parent of project folders. Unset means the platform's root folder.
     */
    private Long parentFolderId;

    private String groupAliasPrefix = "saml:";

    private GroupMatchPolicy groupMatchPolicy = GroupMatchPolicy.LENIENT;

    private UnresolvedTokenPolicy unresolvedTokenPolicy = UnresolvedTokenPolicy.LEAVE;

    /**
     * Wall-clock budget for one provisioning run. Zero or negative disables the check.
     */
    private Duration invocationTimeout = Duration.ofSeconds(120);

    private final Looker looker = new Looker();

    private final Kafka kafka = new Kafka();

    public PlatformType getPlatform() {
        return platform;
    }

    public void setPlatform(PlatformType platform) {
        this.platform = platform;
    }

    public List<Long> getDefaultTemplateDashboardIds() {
        return defaultTemplateDashboardIds;
    }

    public void setDefaultTemplateDashboardIds(List<Long> defaultTemplateDashboardIds) {
        this.defaultTemplateDashboardIds = defaultTemplateDashboardIds != null
            ? defaultTemplateDashboardIds
            : new ArrayList<>();
    }

    public Long getDefaultTemplateFolderId() {
        return defaultTemplateFolderId;
    }

    public void setDefaultTemplateFolderId(Long defaultTemplateFolderId) {
        this.defaultTemplateFolderId = defaultTemplateFolderId;
    }

    public Long getParentFolderId() {
        return parentFolderId;
    }

    public void setParentFolderId(Long parentFolderId) {
        this.parentFolderId = parentFolderId;
    }

    public String getGroupAliasPrefix() {
        return groupAliasPrefix;
    }

    public void setGroupAliasPrefix(String groupAliasPrefix) {
        this.groupAliasPrefix = groupAliasPrefix;
    }

    public GroupMatchPolicy getGroupMatchPolicy() {
        return groupMatchPolicy;
    }

    public void setGroupMatchPolicy(GroupMatchPolicy groupMatchPolicy) {
        this.groupMatchPolicy = groupMatchPolicy;
    }

    public UnresolvedTokenPolicy getUnresolvedTokenPolicy() {
        return unresolvedTokenPolicy;
    }

    public void setUnresolvedTokenPolicy(UnresolvedTokenPolicy unresolvedTokenPolicy) {
        this.unresolvedTokenPolicy = unresolvedTokenPolicy;
    }

    public Duration getInvocationTimeout() {
        return invocationTimeout;
    }

    public void setInvocationTimeout(Duration invocationTimeout) {
        this.invocationTimeout = invocationTimeout;
    }

    public Looker getLooker() {
        return looker;
    }

    public Kafka getKafka() {
        return kafka;
    }

    /**
     * Looker API connection.
     */
    public static class Looker {

        private String baseUrl;
        private String clientId;
        private String clientSecret;
        private String apiVersion = "4.0";
        private Duration requestTimeout = Duration.ofSeconds(30);
        private long rootFolderId = 1L;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getClientId() {
            return clientId;
        }

        public void setClientId(String clientId) {
            this.clientId = clientId;
        }

        public String getClientSecret() {
            return clientSecret;
        }

        public void setClientSecret(String clientSecret) {
            this.clientSecret = clientSecret;
        }

        public String getApiVersion() {
            return apiVersion;
        }

        public void setApiVersion(String apiVersion) {
            this.apiVersion = apiVersion;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }

        public long getRootFolderId() {
            return rootFolderId;
        }

        public void setRootFolderId(long rootFolderId) {
            this.rootFolderId = rootFolderId;
        }

        /**
         * Base url of the versioned REST API, e.g. {@code https://acme.looker.com/api/4.0}.
         */
        public String apiUrl() {
            String base = baseUrl != null ? baseUrl.replaceAll("/+$", "") : "";
            return base + "/api/" + apiVersion;
        }

        @Override
        public String toString() {
            return "Looker{baseUrl='" + baseUrl + "', clientId='" + clientId + "', apiVersion='" + apiVersion
                + "', requestTimeout=" + requestTimeout + "}";
        }
    }

    /**
     * Kafka transport. Off unless {@code enabled} is set.
     */
    public static class Kafka {

        private boolean enabled;
        private String topic = "bi-provisioning-requests";
        private String resultTopic;
        private String consumerGroup = "bi-provisioner";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getTopic() {
            return topic;
        }

        public void setTopic(String topic) {
            this.topic = topic;
        }

        public String getResultTopic() {
            return resultTopic;
        }

        public void setResultTopic(String resultTopic) {
            this.resultTopic = resultTopic;
        }

        public String getConsumerGroup() {
            return consumerGroup;
        }

        public void setConsumerGroup(String consumerGroup) {
            this.consumerGroup = consumerGroup;
        }
    }
}
