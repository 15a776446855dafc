package org.probenet.server.geolocation;

import inet.ipaddr.AddressStringException;
import inet.ipaddr.IPAddress;
import inet.ipaddr.IPAddressString;
import inet.ipaddr.IPAddressStringParameters;
import org.apache.commons.lang3.StringUtils;
import org.probenet.server.log.Logger;
import org.probenet.server.log.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Addresses exempted from the VPN/proxy rejection.
 * <p>
 * Populated once from a newline-delimited list of addresses and CIDR ranges, read-only afterwards.
 */
public class IpAllowlist {

    private static final Logger logger = LoggerFactory.getLogger(IpAllowlist.class);

    private static final String COMMENT_PREFIX = "#";

    private static final IPAddressStringParameters IP_ADDRESS_VALIDATION_OPTIONS =
            IPAddressString.DEFAULT_VALIDATION_OPTIONS.toBuilder()
                    .allowSingleSegment(false)
                    .allowEmpty(false)
                    .toParams();

    private final Set<IPAddress> addresses;
    private final List<IPAddress> ranges;

    private IpAllowlist(Set<IPAddress> addresses, List<IPAddress> ranges) {
        this.addresses = Collections.unmodifiableSet(addresses);
        this.ranges = Collections.unmodifiableList(ranges);
    }

    public static IpAllowlist empty() {
        return new IpAllowlist(Collections.emptySet(), Collections.emptyList());
    }

    public static IpAllowlist parse(String content) {
        final Set<IPAddress> addresses = new HashSet<>();
        final List<IPAddress> ranges = new ArrayList<>();

        for (String line : StringUtils.defaultString(content).split("\n")) {
            final String entry = StringUtils.trim(StringUtils.substringBefore(line, COMMENT_PREFIX));
            if (StringUtils.isEmpty(entry)) {
                continue;
            }

            final IPAddress address = toAddress(entry);
            if (address == null) {
                logger.warn("Skipping invalid allowlist entry: {}", entry);
            } else if (address.isPrefixed()) {
                ranges.add(address.toPrefixBlock());
            } else {
                addresses.add(address);
            }
        }

        logger.info("IP allowlist populated with {} addresses and {} ranges", addresses.size(), ranges.size());
        return new IpAllowlist(addresses, ranges);
    }

    public boolean contains(String ip) {
        final IPAddress address = toAddress(StringUtils.trimToEmpty(ip));
        if (address == null || address.isPrefixed()) {
            return false;
        }

        return addresses.contains(address) || ranges.stream().anyMatch(range -> range.contains(address));
    }

    private static IPAddress toAddress(String value) {
        try {
            return new IPAddressString(value, IP_ADDRESS_VALIDATION_OPTIONS).toAddress();
        } catch (AddressStringException e) {
            return null;
        }
    }
}
