package eu.virtualparadox.ragservice.application.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter @Setter
public class ApplicationConfig {

    private Source source = new Source();
    private Poll poll = new Poll();
    private Index index = new Index();
    private Embedding embedding = new Embedding();
    private Query query = new Query();

    /**
     * Where the producer writes embedding rows.
     */
    @Getter @Setter
    public static class Source {
        private String table = "ragembedding";

        /**
         * Optional timestamp column deciding which row wins when an id appears more than once.
         * Blank means the row read last wins.
         */
        private String recencyColumn;
    }

    @Getter @Setter
    public static class Poll {
        private boolean enabled = true;
        private Duration interval = Duration.ofSeconds(5);
        private Duration refreshInterval = Duration.ofSeconds(60);
        private Duration maxWait = Duration.ofMinutes(10);
        private Duration progressLogInterval = Duration.ofSeconds(30);
    }

    @Getter @Setter
    public static class Index {
        /** When set, records of any other dimension are dropped regardless of the batch majority. */
        private Integer expectedDimension;
    }

    @Getter @Setter
    public static class Embedding {
        private String url = "http://alm-embedding:8080";
        /** Model the stored embeddings are expected to come from; rows naming another model are logged. */
        private String model = "nomic-ai/nomic-embed-text-v1.5";

        /** Model name sent in the {@code model} field of {@code /embeddings} requests, as the server knows it. */
        private String requestModel = "nomic-embed-text-v1.5";
        private String queryPrefix = "search_query: ";
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(30);
    }

    @Getter @Setter
    public static class Query {
        private Duration timeout = Duration.ofSeconds(30);
        private int threads = 4;
    }
}
