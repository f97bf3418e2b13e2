package io.tiller.server.catalog;

import io.tiller.core.contract.Contract;
import io.tiller.core.contract.DefaultMode;
import io.tiller.core.plan.ExecutionPlan;
import io.tiller.core.plan.PlanStep;
import io.tiller.core.plan.PlanTemplates;
import io.tiller.core.plan.QueryComplexity;
import io.tiller.core.router.SourceDefinition;
import io.tiller.core.router.StaticTierRoutingTable;
import io.tiller.core.router.TierRoutingTable;
import java.util.List;
import java.util.Map;

/// Built-in capability contracts, sources, routing table and plan templates for the
/// commerce and travel intents.
///
/// ### Routing table
/// | Intent | Tier 1 | Tier 2 | Tier 3 | Tier 4 |
/// |---|---|---|---|---|
/// | `product`, `comparison` | affiliates, `google_cse_product` | `bing_search`, `youtube_transcripts` | `reddit_api` | `serpapi` |
/// | `price_check` | affiliates | `google_shopping` | - | - |
/// | `review_deep_dive` | `google_cse_product` | `bing_search`, `youtube_transcripts` | `reddit_api` | `serpapi` |
/// | `travel` | `amadeus`, `booking`, `expedia`, `google_cse_travel` | `skyscanner`, `tripadvisor` | - | - |
///
/// @see io.tiller.server.config.TillerEnvironmentProducer
public final class StandardCatalog {

    public static final String ENABLE_SERPAPI = "ENABLE_SERPAPI";
    public static final String ENABLE_REDDIT_API = "ENABLE_REDDIT_API";
    public static final String ENABLE_YOUTUBE_TRANSCRIPTS = "ENABLE_YOUTUBE_TRANSCRIPTS";

    public static final String NEXT_STEP_SUGGESTION = "next_step_suggestion";

    private static final List<String> AFFILIATES =
            List.of("amazon_affiliate", "walmart_affiliate", "bestbuy_affiliate", "ebay_affiliate");

    private StandardCatalog() {}

    /// Returns the built-in capability contracts.
    ///
    /// Commerce capabilities are tagged {@link Contract#ALL_INTENTS} so that the
    /// `comparison`, `price_check` and `review_deep_dive` intents can plan them too.
    ///
    /// @return contracts in registration order, never null
    public static List<Contract> contracts() {
        return List.of(
                Contract.builder("product_search")
                        .purpose("Search retailers and the web for matching products")
                        .requiredFields("product_name")
                        .optionalFields("budget", "brand")
                        .fieldType("budget", "number, maximum price in USD")
                        .successors("product_compose")
                        .orderHint(10)
                        .build(),
                Contract.builder("product_evidence")
                        .purpose("Collect reviews and community opinions for found products")
                        .optionalFields("product_name")
                        .predecessors("product_search")
                        .successors("product_compose")
                        .orderHint(20)
                        .build(),
                Contract.builder("product_affiliate")
                        .purpose("Attach affiliate links to found products")
                        .intent("product")
                        .predecessors("product_search")
                        .successors("product_compose")
                        .defaultMode(DefaultMode.ALWAYS_OPTIONAL)
                        .orderHint(80)
                        .build(),
                Contract.builder("product_compose")
                        .purpose("Write the product answer")
                        .orderHint(90)
                        .build(),
                Contract.builder("travel_destination_facts")
                        .purpose("Look up facts about a destination")
                        .intent("travel")
                        .requiredFields("destination")
                        .successors("travel_compose")
                        .orderHint(10)
                        .build(),
                Contract.builder("travel_search_flights")
                        .purpose("Search flights")
                        .intent("travel")
                        .requiredFields("origin", "destination", "departure_date", "adults")
                        .optionalFields("return_date", "children")
                        .fieldType("departure_date", "date, YYYY-MM-DD")
                        .fieldType("return_date", "date, YYYY-MM-DD")
                        .fieldType("adults", "integer")
                        .successors("travel_compose")
                        .orderHint(20)
                        .build(),
                Contract.builder("travel_search_hotels")
                        .purpose("Search hotels for a destination")
                        .intent("travel")
                        .requiredFields("destination", "duration_days", "adults", "check_in")
                        .optionalFields("check_out", "children")
                        .alias("check_in", "departure_date")
                        .fieldType("check_in", "date, YYYY-MM-DD")
                        .fieldType("duration_days", "integer")
                        .fieldType("adults", "integer")
                        .successors("travel_compose")
                        .orderHint(30)
                        .build(),
                Contract.builder("travel_compose")
                        .purpose("Write the travel answer")
                        .intent("travel")
                        .orderHint(90)
                        .build(),
                Contract.builder(NEXT_STEP_SUGGESTION)
                        .purpose("Suggest what the user could ask next")
                        .defaultMode(DefaultMode.ALWAYS_REQUIRED)
                        .orderHint(100)
                        .build());
    }

    /// Returns the built-in external sources.
    ///
    /// @return sources, never null
    public static List<SourceDefinition> sources() {
        return List.of(
                SourceDefinition.of("amazon_affiliate", "amazon", 0),
                SourceDefinition.of("ebay_affiliate", "ebay", 0),
                SourceDefinition.of("walmart_affiliate", "walmart", 0),
                SourceDefinition.of("bestbuy_affiliate", "bestbuy", 0),
                SourceDefinition.of("google_cse_product", "google_cse", 1),
                SourceDefinition.of("google_cse_travel", "google_cse", 1),
                SourceDefinition.of("bing_search", "bing", 1),
                new SourceDefinition(
                        "youtube_transcripts",
                        "youtube",
                        0,
                        SourceDefinition.DEFAULT_TIMEOUT,
                        false,
                        ENABLE_YOUTUBE_TRANSCRIPTS),
                SourceDefinition.of("google_shopping", "google_shopping", 1),
                new SourceDefinition(
                        "reddit_api",
                        "reddit",
                        1,
                        SourceDefinition.DEFAULT_TIMEOUT,
                        true,
                        ENABLE_REDDIT_API),
                new SourceDefinition(
                        "serpapi", "serpapi", 1, SourceDefinition.DEFAULT_TIMEOUT, true, ENABLE_SERPAPI),
                SourceDefinition.of("amadeus", "amadeus", 0),
                SourceDefinition.of("booking", "booking", 0),
                SourceDefinition.of("expedia", "expedia", 0),
                SourceDefinition.of("skyscanner", "skyscanner", 0),
                SourceDefinition.of("tripadvisor", "tripadvisor", 0));
    }

    /// Returns the built-in intent to tier to sources table.
    ///
    /// @return routing table, never null
    public static TierRoutingTable routingTable() {
        String[] productTier1 = withAffiliates("google_cse_product");
        StaticTierRoutingTable.Builder builder = StaticTierRoutingTable.builder();
        for (String intent : List.of("product", "comparison")) {
            builder.route(intent, 1, productTier1)
                    .route(intent, 2, "bing_search", "youtube_transcripts")
                    .route(intent, 3, "reddit_api")
                    .route(intent, 4, "serpapi");
        }
        return builder.route("price_check", 1, withAffiliates())
                .route("price_check", 2, "google_shopping")
                .route("price_check", 3)
                .route("price_check", 4)
                .route("review_deep_dive", 1, "google_cse_product")
                .route("review_deep_dive", 2, "bing_search", "youtube_transcripts")
                .route("review_deep_dive", 3, "reddit_api")
                .route("review_deep_dive", 4, "serpapi")
                .route("travel", 1, "amadeus", "booking", "expedia", "google_cse_travel")
                .route("travel", 2, "skyscanner", "tripadvisor")
                .route("travel", 3)
                .route("travel", 4)
                .build();
    }

    /// Returns the built-in plan templates.
    ///
    /// Factoid product questions skip evidence gathering; standard ones search and
    /// gather evidence in parallel.
    ///
    /// @return templates, never null
    public static PlanTemplates templates() {
        PlanTemplates templates = new PlanTemplates();
        templates.register(
                "product",
                QueryComplexity.FACTOID,
                ExecutionPlan.of(
                        PlanStep.single("step_0", "product_search"),
                        PlanStep.single("step_1", "product_compose"),
                        PlanStep.single("step_2", NEXT_STEP_SUGGESTION)));
        templates.register(
                "product",
                QueryComplexity.STANDARD,
                ExecutionPlan.of(
                        PlanStep.parallel("step_0", "product_search", "product_evidence"),
                        PlanStep.single("step_1", "product_compose"),
                        PlanStep.single("step_2", NEXT_STEP_SUGGESTION)));
        return templates;
    }

    /// Returns the default value of every source feature flag.
    ///
    /// @return flag to enabled, never null
    public static Map<String, Boolean> defaultFlags() {
        return Map.of(
                ENABLE_SERPAPI, false,
                ENABLE_REDDIT_API, false,
                ENABLE_YOUTUBE_TRANSCRIPTS, true);
    }

    private static String[] withAffiliates(String... extra) {
        String[] names = new String[AFFILIATES.size() + extra.length];
        for (int i = 0; i < AFFILIATES.size(); i++) {
            names[i] = AFFILIATES.get(i);
        }
        System.arraycopy(extra, 0, names, AFFILIATES.size(), extra.length);
        return names;
    }
}
