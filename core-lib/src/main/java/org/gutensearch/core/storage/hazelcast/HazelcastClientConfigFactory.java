package org.gutensearch.core.storage.hazelcast;

import java.time.Duration;

import org.gutensearch.core.model.BookMetadata;
import org.gutensearch.core.storage.StorageSettings;

import com.hazelcast.client.config.ClientConfig;
import com.hazelcast.config.JavaSerializationFilterConfig;

/**
 * Builds Hazelcast {@link ClientConfig} for processes that connect to an existing cluster
 * instead of starting a member.
 *
 * <p>Discovery uses an explicit address list derived from {@code CLUSTER_NODES_LIST} and
 * {@code storage.hazelcast.port}. Startup fails once {@code storage.hazelcast.connect.timeout.ms}
 * elapses without reaching any member.</p>
 */
public final class HazelcastClientConfigFactory {
    private HazelcastClientConfigFactory() {}

    /**
     * Creates a Hazelcast client configuration based on the provided settings.
     *
     * @param settings hazelcast settings (cluster name, member list, etc.)
     * @param callTimeout upper bound for a single invocation
     * @return the Hazelcast {@link ClientConfig}
     */
    public static ClientConfig build(StorageSettings.Hazelcast settings, Duration callTimeout) {
        ClientConfig config = new ClientConfig();
        config.setProperty("hazelcast.logging.type", "slf4j");
        config.setProperty("hazelcast.client.invocation.timeout.seconds",
            String.valueOf(Math.max(1, callTimeout.toSeconds())));
        config.setClusterName(settings.clusterName());

        var network = config.getNetworkConfig();
        network.getAddresses().clear();
        for (String member : settings.members()) {
            HazelcastConfigFactory.expandMemberAddresses(member, settings.memberPorts(), settings.port())
                .forEach(network::addAddress);
        }

        // Give up on an unreachable cluster after the connect timeout.
        config.getConnectionStrategyConfig().getConnectionRetryConfig()
            .setInitialBackoffMillis(500)
            .setMaxBackoffMillis((int) Math.min(Integer.MAX_VALUE, Math.max(500, settings.connectTimeout().toMillis())))
            .setClusterConnectTimeoutMillis(settings.connectTimeout().toMillis());

        configureSerialization(config);
        return config;
    }

    private static void configureSerialization(ClientConfig config) {
        JavaSerializationFilterConfig filter = new JavaSerializationFilterConfig();
        filter.getWhitelist().addClasses(BookMetadata.class.getName());
        config.getSerializationConfig().setJavaSerializationFilterConfig(filter);
    }
}
