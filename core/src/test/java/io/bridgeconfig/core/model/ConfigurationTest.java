package io.bridgeconfig.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.bridgeconfig.core.error.ConfigIssue;
import io.bridgeconfig.core.error.SchemaViolationException;
import io.bridgeconfig.core.testkit.SampleConfigurations;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Tests for the configuration records: field constraints reported all at once, the initial
 * configuration, and copy-on-change behavior.
 */
class ConfigurationTest {

    @Nested
    class Initial {

        @Test
        void initialHasEmptyCollectionsAndZeroFees() {
            Configuration config = Configuration.initial(1, 100);

            assertThat(config.chainId()).isEqualTo(1);
            assertThat(config.block()).isEqualTo(100);
            assertThat(config.tokenAddresses()).isEmpty();
            assertThat(config.requestManager().minFeePpm()).isZero();
            assertThat(config.requestManager().lpFeePpm()).isZero();
            assertThat(config.requestManager().protocolFeePpm()).isZero();
            assertThat(config.requestManager().chains()).isEmpty();
            assertThat(config.requestManager().tokens()).isEmpty();
            assertThat(config.requestManager().whitelist()).isEmpty();
            assertThat(config.fillManager().whitelist()).isEmpty();
        }

        @Test
        void initialRejectsZeroChainIdAndBlockTogether() {
            assertThatThrownBy(() -> Configuration.initial(0, 0))
                    .isInstanceOf(SchemaViolationException.class)
                    .satisfies(e -> assertThat(((SchemaViolationException) e).issues())
                            .extracting(ConfigIssue::path)
                            .containsExactly("$.block", "$.chain_id"));
        }
    }

    @Nested
    class RequestManagerConstraints {

        @Test
        void lpFeeAtUpperBoundIsAccepted() {
            RequestManagerConfig config = RequestManagerConfig.initial().withFees(0, 999_999, 999_999);

            assertThat(config.lpFeePpm()).isEqualTo(999_999);
            assertThat(config.protocolFeePpm()).isEqualTo(999_999);
        }

        @Test
        void lpFeeAboveUpperBoundIsRejected() {
            assertThatThrownBy(() -> RequestManagerConfig.initial().withFees(0, 1_000_000, 0))
                    .isInstanceOf(SchemaViolationException.class)
                    .satisfies(e -> assertThat(((SchemaViolationException) e).issues())
                            .containsExactly(new ConfigIssue("$.lp_fee_ppm", "must be at most 999999, got 1000000")));
        }

        @Test
        void minFeeHasNoUpperBound() {
            assertThat(RequestManagerConfig.initial().withFees(5_000_000, 0, 0).minFeePpm())
                    .isEqualTo(5_000_000);
        }

        @Test
        void everyViolatedFieldIsReported() {
            assertThatThrownBy(() -> new RequestManagerConfig(
                            -1, 1_000_000, -5, Map.of(0L, ChainConfig.of(1, 0, 0)), Map.of(), Set.of()))
                    .isInstanceOf(SchemaViolationException.class)
                    .satisfies(e -> assertThat(((SchemaViolationException) e).issues())
                            .extracting(ConfigIssue::path)
                            .containsExactly("$.min_fee_ppm", "$.lp_fee_ppm", "$.protocol_fee_ppm", "$.chains.0"));
        }

        @Test
        void collectionsAreCopiedAndUnmodifiable() {
            Map<Long, ChainConfig> chains = new LinkedHashMap<>();
            chains.put(5L, ChainConfig.of(1, 0, 0));
            RequestManagerConfig config = new RequestManagerConfig(0, 0, 0, chains, Map.of(), Set.of());
            chains.put(6L, ChainConfig.of(1, 0, 0));

            assertThat(config.chains()).containsOnlyKeys(5L);
            assertThatThrownBy(() -> config.chains().put(7L, ChainConfig.of(1, 0, 0)))
                    .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        void nullCollectionIsRejected() {
            assertThatThrownBy(() -> new RequestManagerConfig(0, 0, 0, null, Map.of(), Set.of()))
                    .isInstanceOf(NullPointerException.class)
                    .hasMessageContaining("chains");
        }
    }

    @Nested
    class ChainAndTokenConstraints {

        @ParameterizedTest
        @ValueSource(longs = {0, -1})
        void finalityPeriodBelowOneIsRejected(long finalityPeriod) {
            assertThatThrownBy(() -> ChainConfig.of(finalityPeriod, 0, 0))
                    .isInstanceOf(SchemaViolationException.class)
                    .hasMessageContaining("$.finality_period");
        }

        @Test
        void chainReportsWeightAndCostTogether() {
            assertThatThrownBy(() -> new ChainConfig(1, 1_000_000, BigInteger.valueOf(-1)))
                    .isInstanceOf(SchemaViolationException.class)
                    .satisfies(e -> assertThat(((SchemaViolationException) e).issues())
                            .extracting(ConfigIssue::path)
                            .containsExactly("$.target_weight_ppm", "$.transfer_cost"));
        }

        @Test
        void tokenAcceptsAmountsBeyondLongRange() {
            BigInteger large = new BigInteger("340282366920938463463374607431768211455");
            TokenConfig token = new TokenConfig(large, BigInteger.ZERO);

            assertThat(token.transferLimit()).isEqualTo(large);
        }

        @Test
        void tokenRejectsNegativeAmounts() {
            assertThatThrownBy(() -> TokenConfig.of(-1, -1))
                    .isInstanceOf(SchemaViolationException.class)
                    .satisfies(e -> assertThat(((SchemaViolationException) e).issues())
                            .extracting(ConfigIssue::path)
                            .containsExactly("$.transfer_limit", "$.eth_in_token"));
        }
    }

    @Nested
    class CopyOnChange {

        @Test
        void withMethodsLeaveTheOriginalUntouched() {
            Configuration original = Configuration.initial(1, 100);
            Configuration changed = original.withBlock(200).withTokenAddress("USDC", SampleConfigurations.USDC_ADDRESS);

            assertThat(original.block()).isEqualTo(100);
            assertThat(original.tokenAddresses()).isEmpty();
            assertThat(changed.block()).isEqualTo(200);
            assertThat(changed.tokenAddresses()).containsEntry("USDC", SampleConfigurations.USDC_ADDRESS);
        }

        @Test
        void withBlockRechecksConstraints() {
            assertThatThrownBy(() -> Configuration.initial(1, 100).withBlock(0))
                    .isInstanceOf(SchemaViolationException.class);
        }

        @Test
        void replacingAnEntryKeepsItsPosition() {
            RequestManagerConfig config = RequestManagerConfig.initial()
                    .withToken("A", TokenConfig.of(1, 1))
                    .withToken("B", TokenConfig.of(2, 2))
                    .withToken("A", TokenConfig.of(3, 3));

            assertThat(config.tokens().keySet()).containsExactly("A", "B");
            assertThat(config.tokens().get("A")).isEqualTo(TokenConfig.of(3, 3));
        }

        @Test
        void whitelistKeepsInsertionOrderAndCollapsesDuplicates() {
            Set<String> input = new LinkedHashSet<>(List.of("0xB", "0xA"));
            FillManagerConfig config = new FillManagerConfig(input).withWhitelisted("0xB").withWhitelisted("0xC");

            assertThat(config.whitelist()).containsExactly("0xB", "0xA", "0xC");
            assertThat(config.withoutWhitelisted("0xA").whitelist()).containsExactly("0xB", "0xC");
        }

        @Test
        void valuesWithSameContentAreEqual() {
            assertThat(SampleConfigurations.deployed()).isEqualTo(SampleConfigurations.deployed());
            assertThat(SampleConfigurations.deployed().hashCode())
                    .isEqualTo(SampleConfigurations.deployed().hashCode());
        }
    }
}
