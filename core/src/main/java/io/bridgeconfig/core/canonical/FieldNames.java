package io.bridgeconfig.core.canonical;

import java.util.List;

/**
 * External field names of the state file. Both the serializer and the reader, as well as the
 * structural schema, take names and field order from here.
 *
 * <p>
 * The two manager sub-objects use capitalized aliases ({@code RequestManager},
 * {@code FillManager}); every other field uses its lower-case name.
 */
public final class FieldNames {

    private FieldNames() {
        // constants
    }

    public static final String CHECKSUM = "checksum";

    // Configuration
    public static final String BLOCK = "block";
    public static final String CHAIN_ID = "chain_id";
    public static final String TOKEN_ADDRESSES = "token_addresses";
    public static final String REQUEST_MANAGER = "RequestManager";
    public static final String FILL_MANAGER = "FillManager";

    // RequestManager
    public static final String MIN_FEE_PPM = "min_fee_ppm";
    public static final String LP_FEE_PPM = "lp_fee_ppm";
    public static final String PROTOCOL_FEE_PPM = "protocol_fee_ppm";
    public static final String CHAINS = "chains";
    public static final String TOKENS = "tokens";
    public static final String WHITELIST = "whitelist";

    // chains.<id>
    public static final String FINALITY_PERIOD = "finality_period";
    public static final String TARGET_WEIGHT_PPM = "target_weight_ppm";
    public static final String TRANSFER_COST = "transfer_cost";

    // tokens.<symbol>
    public static final String TRANSFER_LIMIT = "transfer_limit";
    public static final String ETH_IN_TOKEN = "eth_in_token";

    /** Top-level fields in canonical order (the checksum precedes them in a saved file). */
    public static final List<String> CONFIGURATION =
            List.of(BLOCK, CHAIN_ID, TOKEN_ADDRESSES, REQUEST_MANAGER, FILL_MANAGER);

    public static final List<String> REQUEST_MANAGER_FIELDS =
            List.of(MIN_FEE_PPM, LP_FEE_PPM, PROTOCOL_FEE_PPM, CHAINS, TOKENS, WHITELIST);

    public static final List<String> FILL_MANAGER_FIELDS = List.of(WHITELIST);

    public static final List<String> CHAIN_FIELDS = List.of(FINALITY_PERIOD, TARGET_WEIGHT_PPM, TRANSFER_COST);

    public static final List<String> TOKEN_FIELDS = List.of(TRANSFER_LIMIT, ETH_IN_TOKEN);
}
