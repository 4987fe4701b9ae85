package com.example.convoy.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.example.convoy.feed.ChangeFeed;
import com.example.convoy.feed.FeedMode;
import com.example.convoy.mapping.DedupStoreSettings;

import lombok.Getter;
import lombok.Setter;

/**
 * Everything under {@code convoy.*} in application.properties.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "convoy")
public class ConvoyProperties {

    private Db db = new Db();
    private AuctionsMapping auctionsMapping = new AuctionsMapping();
    private Map<String, Resource> resources = new LinkedHashMap<>();
    private AuctionTypes auctionTypes = new AuctionTypes();
    private Feed feed = new Feed();
    private Retry retry = new Retry();
    private Checkpoint checkpoint = new Checkpoint();

    @Getter
    @Setter
    public static class Db {
        private String host = "localhost";
        private int port = 5984;
        private String name = "auctions";
        private String login;
        private String password;
    }

    /**
     * With {@code host} set the mapping lives in Redis and {@code name} is the
     * database index; without it {@code name} names the embedded store file.
     */
    @Getter
    @Setter
    public static class AuctionsMapping {
        private String host;
        private Integer port;
        private String name;
        private String password;
        private String directory = ".";

        public DedupStoreSettings toSettings() {
            return DedupStoreSettings.resolve(host, port, name, password, directory);
        }
    }

    @Getter
    @Setter
    public static class Resource {
        private Api api = new Api();
        private Map<String, String> ds = new LinkedHashMap<>();
    }

    @Getter
    @Setter
    public static class Api {
        private String url;
        private String token;
        private String version = "2.5";
    }

    @Getter
    @Setter
    public static class AuctionTypes {
        private List<String> basic = new ArrayList<>();
        private List<String> loki = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Feed {
        private String name = "convoy_feed";
        private int limit = ChangeFeed.DEFAULT_LIMIT;
        private Duration idleTimeout = ChangeFeed.DEFAULT_IDLE_TIMEOUT;
        private FeedMode mode = FeedMode.CONTINUOUS;
        private boolean autostart = true;
    }

    @Getter
    @Setter
    public static class Retry {
        private int maxAttempts = 5;
        private Duration initialInterval = Duration.ofMillis(500);
        private double multiplier = 2.0;
        private Duration maxInterval = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Checkpoint {
        private boolean enabled = false;
        private String uri = "mongodb://localhost:27017";
        private String database = "convoy";
        private String collection = "feed_checkpoints";
    }
}
