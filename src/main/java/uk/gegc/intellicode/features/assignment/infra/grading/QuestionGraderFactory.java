package uk.gegc.intellicode.features.assignment.infra.grading;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.intellicode.features.assignment.domain.model.QuestionType;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
public class QuestionGraderFactory {
    private final Map<QuestionType, QuestionGrader> graderMap = new EnumMap<>(QuestionType.class);

    public QuestionGraderFactory(List<QuestionGrader> graders) {
        log.info("Initializing QuestionGraderFactory with {} graders", graders.size());

        graders.forEach(grader -> graderMap.put(grader.supportedType(), grader));

        log.info("QuestionGraderFactory initialized with graders for types: {}", graderMap.keySet());
    }

    public QuestionGrader getGrader(QuestionType type) {
        QuestionGrader grader = graderMap.get(type);
        if (grader == null) {
            throw new UnsupportedOperationException("No grader for type " + type);
        }
        return grader;
    }
}
