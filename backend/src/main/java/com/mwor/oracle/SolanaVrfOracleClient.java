package com.mwor.oracle;

import com.mwor.config.MworRuntimeProperties;
import com.mwor.service.FairnessCrypto;
import org.p2p.solanaj.core.PublicKey;
import org.p2p.solanaj.rpc.RpcClient;
import org.p2p.solanaj.rpc.RpcException;
import org.p2p.solanaj.rpc.types.AccountInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;

/**
 * Reads the fulfilled result of an on-chain VRF account. The account's 32-byte result is
 * domain-separated per purpose and day so one fulfilment never serves two draws with the
 * same bytes.
 */
@Component
@ConditionalOnProperty(prefix = "mwor.oracle", name = "mode", havingValue = "solana")
public class SolanaVrfOracleClient implements VrfOracleClient {

    private static final Logger log = LoggerFactory.getLogger(SolanaVrfOracleClient.class);

    private final RpcClient rpcClient;
    private final MworRuntimeProperties runtimeProperties;

    public SolanaVrfOracleClient(RpcClient rpcClient, MworRuntimeProperties runtimeProperties) {
        this.rpcClient = rpcClient;
        this.runtimeProperties = runtimeProperties;
    }

    @Override
    public VrfOracleResult requestRandomness(String purpose, LocalDate day) {
        String vrfAccount = resolveVrfAccount();
        try {
            AccountInfo accountInfo = rpcClient.getApi().getAccountInfo(new PublicKey(vrfAccount));
            byte[] accountData = decodeAccountData(accountInfo);
            byte[] result = extractResult(accountData);
            long slot = rpcClient.getApi().getSlot();

            byte[] randomness = FairnessCrypto.hmacSha256(result, purpose + "|" + day);
            log.debug("VRF account {} read at slot {} for {} {}", vrfAccount, slot, purpose, day);
            return new VrfOracleResult(randomness, FairnessCrypto.sha256(accountData), vrfAccount + ":" + slot);
        } catch (RpcException ex) {
            throw new IllegalStateException("Failed to read VRF account " + vrfAccount + ": " + ex.getMessage(), ex);
        }
    }

    @Override
    public String describe() {
        return "solana:" + runtimeProperties.getOracle().getVrfAccount();
    }

    private String resolveVrfAccount() {
        String account = runtimeProperties.getOracle().getVrfAccount();
        if (!StringUtils.hasText(account)) {
            throw new IllegalStateException("mwor.oracle.vrf-account must not be blank");
        }
        return account.trim();
    }

    private static byte[] decodeAccountData(AccountInfo accountInfo) {
        if (accountInfo == null || accountInfo.getValue() == null) {
            throw new IllegalStateException("VRF account does not exist");
        }
        List<String> data = accountInfo.getValue().getData();
        if (data == null || data.isEmpty() || !StringUtils.hasText(data.get(0))) {
            throw new IllegalStateException("VRF account has no data");
        }
        return Base64.getDecoder().decode(data.get(0));
    }

    private byte[] extractResult(byte[] accountData) {
        int offset = runtimeProperties.getOracle().getResultOffset();
        if (offset < 0 || accountData.length < offset + FairnessCrypto.SEED_BYTES) {
            throw new IllegalStateException("VRF account data too short for result at offset " + offset);
        }
        byte[] result = Arrays.copyOfRange(accountData, offset, offset + FairnessCrypto.SEED_BYTES);
        boolean fulfilled = false;
        for (byte b : result) {
            if (b != 0) {
                fulfilled = true;
                break;
            }
        }
        if (!fulfilled) {
            throw new IllegalStateException("VRF account result is not fulfilled yet");
        }
        return result;
    }
}
