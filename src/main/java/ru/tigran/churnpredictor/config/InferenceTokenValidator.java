package ru.tigran.churnpredictor.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import ru.tigran.churnpredictor.exception.InitializationException;

/**
 * Checks the inference credentials once at startup.
 *
 * A missing token only degrades enrichment, so by default it is reported as a warning.
 * With {@code app.inference.require-token=true} the application refuses to start.
 */
@Slf4j
@Component
public class InferenceTokenValidator implements ApplicationRunner {

    private static final String ENV_VAR_NAME = "HF_TOKEN";

    private final String apiToken;
    private final boolean requireToken;

    public InferenceTokenValidator(
            @Value("${app.inference.api-token:}") String apiToken,
            @Value("${app.inference.require-token:false}") boolean requireToken
    ) {
        this.apiToken = apiToken;
        this.requireToken = requireToken;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("Validating inference token configuration (required: {})", requireToken);

        String problem = findProblem();
        if (problem == null) {
            log.info("Inference token validation completed successfully");
            return;
        }
        if (requireToken) {
            throw new InitializationException(problem);
        }
        log.warn("{} Sentiment and topic enrichment will degrade to defaults.", problem);
    }

    String findProblem() {
        if (apiToken == null || apiToken.isBlank()) {
            return String.format("%s environment variable is not set!", ENV_VAR_NAME);
        }
        if (apiToken.contains("YOUR_") || apiToken.contains("PLACEHOLDER")) {
            return String.format("%s contains placeholder value!", ENV_VAR_NAME);
        }
        return null;
    }
}
