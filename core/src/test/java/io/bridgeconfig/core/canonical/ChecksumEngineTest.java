package io.bridgeconfig.core.canonical;

import static org.assertj.core.api.Assertions.assertThat;

import io.bridgeconfig.core.model.Configuration;
import io.bridgeconfig.core.model.TokenConfig;
import io.bridgeconfig.core.testkit.SampleConfigurations;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ChecksumEngine}. Expected digests were computed with Python's
 * {@code hashlib.sha256(json.dumps(data, indent=4) + "\n")} over the same data, which is how
 * published state files are hashed.
 */
class ChecksumEngineTest {

    @Test
    void initialCanonicalTextMatchesReferenceLayout() {
        assertThat(ChecksumEngine.canonicalText(Configuration.initial(1, 100))).isEqualTo("""
                {
                    "block": 100,
                    "chain_id": 1,
                    "token_addresses": {},
                    "RequestManager": {
                        "min_fee_ppm": 0,
                        "lp_fee_ppm": 0,
                        "protocol_fee_ppm": 0,
                        "chains": {},
                        "tokens": {},
                        "whitelist": []
                    },
                    "FillManager": {
                        "whitelist": []
                    }
                }
                """);
    }

    @Test
    void initialChecksumIsStable() {
        assertThat(Configuration.initial(1, 100).computeChecksum()).isEqualTo(SampleConfigurations.INITIAL_CHECKSUM);
        assertThat(Configuration.initial(1, 100).computeChecksum())
                .isEqualTo(Configuration.initial(1, 100).computeChecksum());
    }

    @Test
    void deployedChecksumMatchesReference() {
        assertThat(SampleConfigurations.deployed().computeChecksum())
                .isEqualTo(SampleConfigurations.DEPLOYED_CHECKSUM);
    }

    @Test
    void nonAsciiTokenSymbolMatchesReference() {
        Configuration config = SampleConfigurations.deployed()
                .withoutTokenAddress("USDC")
                .withoutTokenAddress("WETH")
                .withTokenAddress("USDCé", SampleConfigurations.USDC_ADDRESS)
                .withRequestManager(SampleConfigurations.deployed()
                        .requestManager()
                        .withoutToken("USDC")
                        .withoutToken("WETH")
                        .withToken("USDCé", TokenConfig.of(1, 2)));

        assertThat(config.computeChecksum())
                .isEqualTo("874dc9a5fe33f11c16ad67801d2416015261888dcec0850dd31b30eadc5e524e");
    }

    @Test
    void anyFieldChangeChangesTheChecksum() {
        Configuration config = SampleConfigurations.deployed();

        assertThat(config.withBlock(123457).computeChecksum()).isNotEqualTo(config.computeChecksum());
        assertThat(config.withFillManager(config.fillManager().withoutWhitelisted(SampleConfigurations.FILLER_ADDRESS))
                        .computeChecksum())
                .isNotEqualTo(config.computeChecksum());
    }

    @Test
    void checksumIsLowerCaseHexSha256() {
        assertThat(ChecksumEngine.sha256Hex(""))
                .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
        assertThat(SampleConfigurations.deployed().computeChecksum()).matches("[0-9a-f]{64}");
    }
}
