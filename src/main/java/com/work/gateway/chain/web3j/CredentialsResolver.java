package com.work.gateway.chain.web3j;

import org.web3j.crypto.Credentials;

/**
 * 按地址取签名凭证。私钥的存储与加解密由宿主负责，网关不内置实现。
 */
@FunctionalInterface
public interface CredentialsResolver {

    /**
     * @throws IllegalArgumentException 地址没有可用凭证
     */
    Credentials resolve(String address);
}
