package org.cellar.search.hazelcast;

import org.cellar.search.config.SearchConfig;

import com.hazelcast.client.config.ClientConfig;
import com.hazelcast.config.JavaSerializationFilterConfig;

/**
 * Builds Hazelcast {@link ClientConfig} for the Search Service.
 *
 * <p>The Search Service connects as a Hazelcast <em>client</em> to the members started by the Indexing Service
 * and only reads the primary index. Discovery uses an explicit address list derived from
 * {@code CLUSTER_NODES_LIST} and {@code hazelcast.port}.</p>
 */
public final class HazelcastClientConfigFactory {
    private HazelcastClientConfigFactory() {}

    /**
     * Creates a Hazelcast client configuration based on the provided settings.
     *
     * @param settings hazelcast settings (cluster name, member list, etc.)
     * @return the Hazelcast {@link ClientConfig}
     */
    public static ClientConfig build(SearchConfig.Hazelcast settings) {
        ClientConfig config = new ClientConfig();
        config.setClusterName(settings.clusterName());
        config.setProperty("hazelcast.logging.type", "slf4j");

        var network = config.getNetworkConfig();
        network.getAddresses().clear();
        settings.members().forEach(ip -> network.addAddress(ip + ":" + settings.port()));

        config.getConnectionStrategyConfig().getConnectionRetryConfig()
            .setClusterConnectTimeoutMillis(settings.connectTimeoutMillis());

        configureSerialization(config);
        return config;
    }

    private static void configureSerialization(ClientConfig config) {
        JavaSerializationFilterConfig filter = new JavaSerializationFilterConfig();
        filter.getWhitelist().addPrefixes("org.cellar.core.", "java.util.", "java.lang.");
        config.getSerializationConfig().setJavaSerializationFilterConfig(filter);
    }
}
