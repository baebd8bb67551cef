package net.keygate.bootstrap.props;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties("keygate")
public class KeygateProperties {
    private Pool pool = new Pool();
    private Token token = new Token();
    private Reaper reaper = new Reaper();
    private Handoff handoff = new Handoff();
    private Catalog catalog = new Catalog();

    public Pool getPool() {
        return pool;
    }

    public void setPool(Pool pool) {
        this.pool = pool;
    }

    public Token getToken() {
        return token;
    }

    public void setToken(Token token) {
        this.token = token;
    }

    public Reaper getReaper() {
        return reaper;
    }

    public void setReaper(Reaper reaper) {
        this.reaper = reaper;
    }

    public Handoff getHandoff() {
        return handoff;
    }

    public void setHandoff(Handoff handoff) {
        this.handoff = handoff;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public static class Pool {
        private int maxClaimCount = 25;
        private boolean releaseOnSubjectDeletion = false;
        private Duration retryAfter = Duration.ofSeconds(30);

        public int getMaxClaimCount() {
            return maxClaimCount;
        }

        public void setMaxClaimCount(int maxClaimCount) {
            this.maxClaimCount = maxClaimCount;
        }

        public boolean isReleaseOnSubjectDeletion() {
            return releaseOnSubjectDeletion;
        }

        public void setReleaseOnSubjectDeletion(boolean releaseOnSubjectDeletion) {
            this.releaseOnSubjectDeletion = releaseOnSubjectDeletion;
        }

        public Duration getRetryAfter() {
            return retryAfter;
        }

        public void setRetryAfter(Duration retryAfter) {
            this.retryAfter = retryAfter;
        }
    }

    public static class Token {
        /** base64, 디코딩 후 32바이트 이상. 없으면 기동 실패. */
        private String hmacKey;
        private Duration credentialTtl = Duration.ofSeconds(180);

        public String getHmacKey() {
            return hmacKey;
        }

        public void setHmacKey(String hmacKey) {
            this.hmacKey = hmacKey;
        }

        public Duration getCredentialTtl() {
            return credentialTtl;
        }

        public void setCredentialTtl(Duration credentialTtl) {
            this.credentialTtl = credentialTtl;
        }

        @Override
        public String toString() {
            return "Token{hmacKey=" + (hmacKey == null ? "<unset>" : "<redacted>") + ", credentialTtl=" + credentialTtl + '}';
        }
    }

    public static class Reaper {
        private boolean enabled = true;
        private long slotDelayMs = 60_000;
        private long tokenDelayMs = 30_000;
        private Duration tokenRetention = Duration.ofDays(30);
        private int batchSize = 500;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getSlotDelayMs() {
            return slotDelayMs;
        }

        public void setSlotDelayMs(long slotDelayMs) {
            this.slotDelayMs = slotDelayMs;
        }

        public long getTokenDelayMs() {
            return tokenDelayMs;
        }

        public void setTokenDelayMs(long tokenDelayMs) {
            this.tokenDelayMs = tokenDelayMs;
        }

        public Duration getTokenRetention() {
            return tokenRetention;
        }

        public void setTokenRetention(Duration tokenRetention) {
            this.tokenRetention = tokenRetention;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    public static class Handoff {
        private String baseUrl = "http://localhost:8080";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }

    public static class Catalog {
        private boolean enabled = true;
        private List<ProductDef> products = new ArrayList<>(); // ← 가변

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<ProductDef> getProducts() {
            return products;
        }

        public void setProducts(List<ProductDef> products) {
            this.products = products;
        }
    }

    public static class ProductDef {
        private String name;
        private String description;
        private String payload;
        private int maxConcurrentSlots = 2;
        private Duration slotTtl = Duration.ofSeconds(7200);
        private Duration tokenTtl = Duration.ofSeconds(7200);
        private boolean active = true;
        private String downloadFilename;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public String getPayload() {
            return payload;
        }

        public void setPayload(String payload) {
            this.payload = payload;
        }

        public int getMaxConcurrentSlots() {
            return maxConcurrentSlots;
        }

        public void setMaxConcurrentSlots(int maxConcurrentSlots) {
            this.maxConcurrentSlots = maxConcurrentSlots;
        }

        public Duration getSlotTtl() {
            return slotTtl;
        }

        public void setSlotTtl(Duration slotTtl) {
            this.slotTtl = slotTtl;
        }

        public Duration getTokenTtl() {
            return tokenTtl;
        }

        public void setTokenTtl(Duration tokenTtl) {
            this.tokenTtl = tokenTtl;
        }

        public boolean isActive() {
            return active;
        }

        public void setActive(boolean active) {
            this.active = active;
        }

        public String getDownloadFilename() {
            return downloadFilename;
        }

        public void setDownloadFilename(String downloadFilename) {
            this.downloadFilename = downloadFilename;
        }

        @Override
        public String toString() {
            return "ProductDef{" +
                    "name='" + name + '\'' +
                    ", maxConcurrentSlots=" + maxConcurrentSlots +
                    ", slotTtl=" + slotTtl +
                    ", tokenTtl=" + tokenTtl +
                    ", active=" + active +
                    '}';
        }
    }
}
