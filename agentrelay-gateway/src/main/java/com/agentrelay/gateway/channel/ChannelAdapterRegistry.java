package com.agentrelay.gateway.channel;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Channel adapters known to one gateway instance.
 */
@Slf4j
public class ChannelAdapterRegistry {

    private final Map<String, ChannelAdapter> adapters = new ConcurrentHashMap<>();

    public void register(ChannelAdapter adapter) {
        adapters.put(adapter.channelId(), adapter);
        log.info("Registered channel adapter: {}", adapter.channelId());
    }

    public boolean unregister(String channelId) {
        return adapters.remove(channelId) != null;
    }

    public Optional<ChannelAdapter> find(String channelId) {
        if (channelId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(adapters.get(channelId));
    }

    public List<String> channelIds() {
        return adapters.keySet().stream().sorted().toList();
    }
}
