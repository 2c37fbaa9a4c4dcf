package com.work.gateway.core.chain;

import java.util.Objects;

import static com.work.gateway.core.support.ValidationUtils.requireNonEmpty;

/**
 * (chain, network) 组合键，例如 ethereum:mainnet。
 */
public final class ChainKey {

    private final String chain;
    private final String network;

    public ChainKey(String chain, String network) {
        this.chain = requireNonEmpty(chain, "chain").trim().toLowerCase();
        this.network = requireNonEmpty(network, "network").trim().toLowerCase();
    }

    public static ChainKey of(String chain, String network) {
        return new ChainKey(chain, network);
    }

    /**
     * 解析 "chain:network" 形式的字符串（持久化时使用该形式）。
     */
    public static ChainKey parse(String value) {
        requireNonEmpty(value, "chainKey");
        int idx = value.indexOf(':');
        if (idx <= 0 || idx == value.length() - 1) {
            throw new IllegalArgumentException("chainKey 格式应为 chain:network, 实际为 " + value);
        }
        return new ChainKey(value.substring(0, idx), value.substring(idx + 1));
    }

    public String getChain() {
        return chain;
    }

    public String getNetwork() {
        return network;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChainKey)) return false;
        ChainKey that = (ChainKey) o;
        return chain.equals(that.chain) && network.equals(that.network);
    }

    @Override
    public int hashCode() {
        return Objects.hash(chain, network);
    }

    @Override
    public String toString() {
        return chain + ":" + network;
    }
}
