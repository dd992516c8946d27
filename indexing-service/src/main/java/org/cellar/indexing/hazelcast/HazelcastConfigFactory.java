package org.cellar.indexing.hazelcast;

import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.util.Enumeration;
import java.util.LinkedHashSet;
import java.util.List;

import org.cellar.indexing.config.IndexingConfig;

import com.hazelcast.config.Config;
import com.hazelcast.config.JavaSerializationFilterConfig;
import com.hazelcast.config.MapConfig;
import com.hazelcast.config.MultiMapConfig;
import com.hazelcast.config.MultiMapConfig.ValueCollectionType;
import com.hazelcast.config.SetConfig;

/**
 * Builds Hazelcast {@link Config} for the Indexing Service.
 *
 * <p>Uses TCP-IP discovery with a fixed member list and disables multicast/auto-detection. The indexing service
 * owns the primary index: indexed records in a map, postings in a set-valued multimap, and the mirror's
 * pending-resync ids in a set.</p>
 */
public final class HazelcastConfigFactory {
    private HazelcastConfigFactory() {}

    /**
     * Creates a Hazelcast configuration based on the provided settings.
     *
     * @param settings hazelcast settings (cluster name, member list, structure names, etc.)
     * @return the Hazelcast {@link Config}
     */
    public static Config build(IndexingConfig.Hazelcast settings) {
        Config config = new Config();
        configureCluster(config, settings);
        configureNetwork(config, settings);
        configureDataStructures(config, settings);
        configureSerialization(config);
        return config;
    }

    private static void configureCluster(Config config, IndexingConfig.Hazelcast s) {
        config.setClusterName(s.clusterName());
        config.setProperty("hazelcast.logging.type", "slf4j");
        config.setProperty("hazelcast.phone.home.enabled", "false");
    }

    private static void configureNetwork(Config config, IndexingConfig.Hazelcast s) {
        config.getNetworkConfig().setPort(s.port()).setPortAutoIncrement(false);

        // Interface matching only works when CURRENT_NODE_IP is assigned locally (not the case inside Docker).
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
        } catch (UnknownHostException | SocketException | SecurityException e) {
            return false;
        }
        return false;
    }

    private static void configureJoin(Config config, IndexingConfig.Hazelcast s) {
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
        expanded.stream().filter(addr -> !addr.isBlank()).forEach(tcpIp::addMember);
    }

    static List<String> expandMemberAddresses(String member, List<Integer> memberPorts, int defaultPort) {
        if (member == null) {
            return List.of();
        }
        String trimmed = member.trim();
        if (trimmed.isEmpty()) {
            return List.of();
        }

        // ip:port is taken as given.
        if (trimmed.contains(":")) {
            return List.of(trimmed);
        }

        if (memberPorts != null && !memberPorts.isEmpty()) {
            return memberPorts.stream().map(p -> trimmed + ":" + p).toList();
        }

        return List.of(trimmed + ":" + defaultPort);
    }

    private static void configureDataStructures(Config config, IndexingConfig.Hazelcast s) {
        config.addMapConfig(new MapConfig(s.recordMapName())
            .setBackupCount(s.backupCount())
            .setAsyncBackupCount(s.asyncBackupCount()));

        config.addMultiMapConfig(
            new MultiMapConfig(s.postingsName())
                .setBackupCount(s.backupCount())
                .setAsyncBackupCount(s.asyncBackupCount())
                .setValueCollectionType(ValueCollectionType.SET)
        );

        config.addSetConfig(new SetConfig(s.pendingResyncName())
            .setBackupCount(s.backupCount())
            .setAsyncBackupCount(s.asyncBackupCount()));
    }

    private static void configureSerialization(Config config) {
        JavaSerializationFilterConfig filter = new JavaSerializationFilterConfig();
        filter.getWhitelist().addPrefixes("org.cellar.core.", "java.util.", "java.lang.");
        config.getSerializationConfig().setJavaSerializationFilterConfig(filter);
    }
}
