package org.internmatch.engine;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.internmatch.engine.api.CatalogApiClientImpl;
import org.internmatch.engine.api.dto.CandidateDto;
import org.internmatch.engine.api.dto.RecommendationDto;
import org.internmatch.engine.cache.CatalogCache;
import org.internmatch.engine.cache.CatalogCacheImpl;
import org.internmatch.engine.config.EngineConfig;
import org.internmatch.engine.domain.capacity.CapacityTracker;
import org.internmatch.engine.domain.capacity.InMemoryCapacityTracker;
import org.internmatch.engine.domain.exception.ValidationException;
import org.internmatch.engine.domain.model.Candidate;
import org.internmatch.engine.domain.model.EducationLevel;
import org.internmatch.engine.domain.model.Recommendation;
import org.internmatch.engine.domain.model.ScoringRequest;
import org.internmatch.engine.domain.model.SocialCategory;
import org.internmatch.engine.domain.scoring.ScoringService;
import org.internmatch.engine.domain.scoring.ScoringServiceImpl;
import org.internmatch.engine.domain.service.RecommendationService;
import org.internmatch.engine.domain.service.RecommendationServiceImpl;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import java.util.stream.Collectors;

/**
 * Main entry point for the allocation engine.
 *
 * Usage: {@code engine [candidate.json] [topK]}
 * Ranks the catalog for the candidate in the JSON file (or a built-in demo profile) and prints
 * the recommendations as JSON on stdout.
 */
public final class Main {

    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID_INPUT = 2;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final EngineConfig config;

    Main(EngineConfig config) {
        this.config = config;
    }

    public static void main(String[] args) {
        try {
            EngineConfig config = EngineConfig.fromEnvironment();
            configureLogging(config);
            int exitCode = new Main(config).run(args, System.out);
            if (exitCode != EXIT_OK) {
                System.exit(exitCode);
            }
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Engine run failed", e);
            System.exit(1);
        }
    }

    int run(String[] args, PrintStream out) throws IOException {
        LOG.info(() -> "Configuration: " + config);

        CapacityTracker capacityTracker = new InMemoryCapacityTracker();
        CatalogCache cache = config.isCatalogEnabled()
                ? new CatalogCacheImpl(new CatalogApiClientImpl(config.getCatalogApiUrl(), config.getCatalogApiToken()),
                capacityTracker)
                : new CatalogCacheImpl(capacityTracker);
        cache.refresh();

        if (config.isCatalogEnabled() && !cache.isInitialized()) {
            LOG.warning("Catalog API not available, using sample catalog");
        }

        ScoringService scoringService = new ScoringServiceImpl(
                config.getSkillFuzzyThreshold(), config.getSkillPartialCredit());
        RecommendationService recommendationService =
                new RecommendationServiceImpl(scoringService, capacityTracker);

        try {
            Candidate candidate = args.length > 0 ? readCandidate(Paths.get(args[0])) : demoCandidate();
            int topK = args.length > 1 ? parseTopK(args[1]) : config.getTopK();

            ScoringRequest request = ScoringRequest.of(candidate, cache.getInternships(), cache.getWeights(), topK);
            List<Recommendation> recommendations = recommendationService.recommend(request);

            List<RecommendationDto> body = recommendations.stream()
                    .map(RecommendationDto::from)
                    .collect(Collectors.toList());
            out.println(MAPPER.writeValueAsString(body));
            return EXIT_OK;

        } catch (ValidationException e) {
            LOG.warning(() -> "Invalid input: " + e.getMessage());
            return EXIT_INVALID_INPUT;
        }
    }

    private static Candidate readCandidate(Path path) throws IOException {
        LOG.info(() -> "Reading candidate profile from " + path.toAbsolutePath());
        CandidateDto dto = MAPPER.readValue(path.toFile(), CandidateDto.class);
        return dto.toDomain();
    }

    private static int parseTopK(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("topK must be an integer, got " + value, e);
        }
    }

    private static Candidate demoCandidate() {
        LOG.info("No candidate file given, using demo profile");
        return Candidate.builder()
                .id("demo")
                .name("Priya Sharma")
                .educationLevel(EducationLevel.BACHELOR)
                .skills(Arrays.asList("Python", "JavaScript", "React", "SQL"))
                .location("Bangalore")
                .sectorInterests(Arrays.asList("Technology", "Software Development"))
                .socialCategory(SocialCategory.GENERAL)
                .build();
    }

    /**
     * Configure file logging if enabled.
     */
    private static void configureLogging(EngineConfig config) {
        Logger root = Logger.getLogger("");
        root.setLevel(Level.INFO);

        if (!config.isFileLoggingEnabled()) {
            return;
        }

        String logFilePath = config.getLogFilePath();
        Path target = Paths.get(logFilePath).toAbsolutePath();

        try {
            Files.createDirectories(target.getParent());
            FileHandler handler = new FileHandler(target.toString(), 5 * 1024 * 1024, 3, true);
            handler.setFormatter(new SimpleFormatter());
            root.addHandler(handler);
            LOG.info(() -> "File logging enabled: " + target);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to setup file logging", e);
        }
    }
}
