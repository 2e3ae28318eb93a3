package org.gutensearch.core.storage.hazelcast;

import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Enumeration;
import java.util.LinkedHashSet;
import java.util.List;

import org.gutensearch.core.model.BookMetadata;
import org.gutensearch.core.storage.StorageSettings;

import com.hazelcast.config.Config;
import com.hazelcast.config.InMemoryFormat;
import com.hazelcast.config.JavaSerializationFilterConfig;
import com.hazelcast.config.MapConfig;
import com.hazelcast.config.MultiMapConfig;
import com.hazelcast.config.MultiMapConfig.ValueCollectionType;
import com.hazelcast.config.NearCacheConfig;

/**
 * Builds the Hazelcast member {@link Config} shared by the indexing and search services.
 *
 * <p>Uses TCP-IP discovery with a fixed member list and disables multicast/auto-detection.
 * The inverted index multimap keeps its values in a set, so adding the same book to a word
 * twice is a no-op. Both services must build the same data-structure configuration.</p>
 */
public final class HazelcastConfigFactory {
    private HazelcastConfigFactory() {}

    /**
     * Creates a Hazelcast member configuration based on the provided settings.
     *
     * @param settings hazelcast settings (cluster name, member list, map names, etc.)
     * @param callTimeout upper bound for a single map operation
     * @return the Hazelcast {@link Config}
     */
    public static Config build(StorageSettings.Hazelcast settings, Duration callTimeout) {
        Config config = new Config();
        config.setProperty("hazelcast.logging.type", "slf4j");
        config.setProperty("hazelcast.phone.home.enabled", "false");
        config.setProperty("hazelcast.operation.call.timeout.millis", String.valueOf(callTimeout.toMillis()));
        config.setClusterName(settings.clusterName());
        configureNetwork(config, settings);
        configureDataStructures(config, settings);
        configureSerialization(config);
        return config;
    }

    private static void configureNetwork(Config config, StorageSettings.Hazelcast s) {
        config.getNetworkConfig().setPort(s.port()).setPortAutoIncrement(false);

        // Containers usually do not own the host IP; binding to it would fail startup.
        if (isLocalInterfaceAddress(s.currentNodeIp())) {
            config.getNetworkConfig().getInterfaces().setEnabled(true).addInterface(s.currentNodeIp());
        } else {
            config.getNetworkConfig().getInterfaces().setEnabled(false);
        }

        config.getNetworkConfig().setPublicAddress(s.currentNodeIp() + ":" + s.port());
        configureJoin(config, s);
    }

    static boolean isLocalInterfaceAddress(String ip) {
        if (ip == null || ip.isBlank()) {
            return false;
        }
        String trimmed = ip.trim();
        if ("localhost".equalsIgnoreCase(trimmed) || "127.0.0.1".equals(trimmed)) {
            return true;
        }

        try {
            InetAddress target = InetAddress.getByName(trimmed);
            Enumeration<NetworkInterface> ifaces = NetworkInterface.getNetworkInterfaces();
            if (ifaces == null) {
                return false;
            }
            while (ifaces.hasMoreElements()) {
                Enumeration<InetAddress> addrs = ifaces.nextElement().getInetAddresses();
                while (addrs.hasMoreElements()) {
                    if (addrs.nextElement().equals(target)) {
                        return true;
                    }
                }
            }
            return false;
        } catch (UnknownHostException | SocketException e) {
            return false;
        }
    }

    private static void configureJoin(Config config, StorageSettings.Hazelcast s) {
        var join = config.getNetworkConfig().getJoin();
        join.getMulticastConfig().setEnabled(false);
        join.getAutoDetectionConfig().setEnabled(false);

        var tcpIp = join.getTcpIpConfig();
        tcpIp.setEnabled(true);
        tcpIp.getMembers().clear();
        LinkedHashSet<String> expanded = new LinkedHashSet<>();
        for (String member : s.members()) {
            expanded.addAll(expandMemberAddresses(member, s.memberPorts(), s.port()));
        }
        expanded.forEach(tcpIp::addMember);
    }

    /**
     * Expands a bare IP into {@code ip:port} entries for every known member port.
     * Entries that already carry a port are kept as they are.
     */
    static List<String> expandMemberAddresses(String member, List<Integer> memberPorts, int defaultPort) {
        if (member == null || member.isBlank()) {
            return List.of();
        }
        String trimmed = member.trim();

        if (trimmed.contains(":")) {
            return List.of(trimmed);
        }

        if (memberPorts != null && !memberPorts.isEmpty()) {
            return memberPorts.stream().map(p -> trimmed + ":" + p).toList();
        }

        return List.of(trimmed + ":" + defaultPort);
    }

    private static void configureDataStructures(Config config, StorageSettings.Hazelcast s) {
        MapConfig metadataCfg = new MapConfig(s.metadataMapName())
            .setBackupCount(s.backupCount())
            .setAsyncBackupCount(s.asyncBackupCount());
        metadataCfg.setNearCacheConfig(
            new NearCacheConfig()
                .setInMemoryFormat(InMemoryFormat.OBJECT)
                .setInvalidateOnChange(true)
                .setCacheLocalEntries(true)
        );
        config.addMapConfig(metadataCfg);

        config.addMultiMapConfig(
            new MultiMapConfig(s.invertedIndexName())
                .setBackupCount(s.backupCount())
                .setAsyncBackupCount(s.asyncBackupCount())
                .setValueCollectionType(ValueCollectionType.SET)
        );
    }

    private static void configureSerialization(Config config) {
        JavaSerializationFilterConfig filter = new JavaSerializationFilterConfig();
        filter.getWhitelist().addClasses(BookMetadata.class.getName());
        config.getSerializationConfig().setJavaSerializationFilterConfig(filter);
    }
}
