package uk.gegc.intellicode.features.assignment.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "assignment_questions")
public class Question {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "question_id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "assignment_id", nullable = false)
    private Assignment assignment;

    @Column(name = "sort_order", nullable = false)
    private int position;

    @Column(name = "question_text", nullable = false, length = 2000)
    private String text;

    @Enumerated(EnumType.STRING)
    @Column(name = "question_type", nullable = false, length = 20)
    private QuestionType type;

    @Column(name = "points", nullable = false)
    private int points;

    @Column(name = "correct_answer", length = 1000)
    private String correctAnswer;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "question_correct_answers", joinColumns = @JoinColumn(name = "question_id"))
    @OrderColumn(name = "answer_order")
    @Column(name = "answer_text", nullable = false, length = 1000)
    private List<String> correctAnswers = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "question_options", joinColumns = @JoinColumn(name = "question_id"))
    @OrderColumn(name = "option_order")
    @Column(name = "option_text", nullable = false, length = 1000)
    private List<String> options = new ArrayList<>();

    @Column(name = "explanation", length = 2000)
    private String explanation;

    @Column(name = "is_true")
    private Boolean isTrue;

    @Column(name = "case_sensitive", nullable = false)
    private boolean caseSensitive;

    public boolean hasCorrectAnswers() {
        return correctAnswers != null && !correctAnswers.isEmpty();
    }
}
