package dev.aparikh.hybridsearch.evaluation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads relevance judgments from a JSON Lines file, one judgment object per line.
 *
 * <p>Blank lines are skipped. A line that is not a judgment object, or that has no query, is
 * returned as a {@link RejectedJudgment} with its 1-based line number; it never stops the load.</p>
 */
@Component
public class JudgmentLoader {

    private static final Logger log = LoggerFactory.getLogger(JudgmentLoader.class);

    private final ObjectMapper objectMapper;

    public JudgmentLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws IOException if the file cannot be read
     */
    public LoadedJudgments load(Path file) throws IOException {
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        List<RelevanceJudgment> judgments = new ArrayList<>();
        List<RejectedJudgment> rejected = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).strip();
            if (line.isEmpty()) {
                continue;
            }
            int lineNumber = i + 1;
            try {
                RelevanceJudgment judgment = objectMapper.readValue(line, RelevanceJudgment.class);
                if (judgment == null || !judgment.hasQuery()) {
                    rejected.add(new RejectedJudgment(lineNumber, "missing query"));
                } else {
                    judgments.add(judgment);
                }
            } catch (JsonProcessingException e) {
                rejected.add(new RejectedJudgment(lineNumber, e.getOriginalMessage()));
            }
        }
        if (!rejected.isEmpty()) {
            log.warn("Rejected {} of {} judgment lines in {}", rejected.size(), judgments.size() + rejected.size(), file);
        }
        log.debug("Loaded {} judgments from {}", judgments.size(), file);
        return new LoadedJudgments(judgments, rejected);
    }
}
