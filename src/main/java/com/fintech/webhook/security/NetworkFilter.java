package com.fintech.webhook.security;

import com.fintech.webhook.config.WebhookProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Admits callers whose address falls inside one of the trusted networks.
 * The network list is parsed once and never changes afterwards.
 */
@Slf4j
@Component
public class NetworkFilter {

    private final List<IpNetwork> trustedNetworks;

    @Autowired
    public NetworkFilter(WebhookProperties properties) {
        this(properties.getNetwork().getTrustedNetworks());
    }

    NetworkFilter(List<String> entries) {
        List<IpNetwork> parsed = new ArrayList<>();
        for (String entry : entries) {
            try {
                parsed.add(IpNetwork.parse(entry));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping malformed trusted network entry '{}': {}", entry, e.getMessage());
            }
        }
        this.trustedNetworks = List.copyOf(parsed);

        if (trustedNetworks.isEmpty()) {
            log.warn("No trusted networks configured, every caller will be rejected");
        } else {
            log.info("Loaded {} trusted networks: {}", trustedNetworks.size(), trustedNetworks);
        }
    }

    public boolean admit(String callerIp) {
        byte[] address = IpNetwork.parseAddress(callerIp);
        if (address == null) {
            log.warn("Rejecting unparseable caller address '{}'", callerIp);
            return false;
        }
        for (IpNetwork network : trustedNetworks) {
            if (network.contains(address)) {
                return true;
            }
        }
        return false;
    }

    public List<IpNetwork> getTrustedNetworks() {
        return trustedNetworks;
    }
}
