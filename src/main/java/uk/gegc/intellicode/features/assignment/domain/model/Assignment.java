package uk.gegc.intellicode.features.assignment.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import uk.gegc.intellicode.features.course.domain.model.Course;
import uk.gegc.intellicode.features.course.domain.model.CourseModule;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "assignments")
public class Assignment {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "assignment_id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "module_id", nullable = false)
    private CourseModule module;

    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "description", length = 4000)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "subtype", nullable = false, length = 20)
    private AssignmentSubtype subtype;

    @Column(name = "points", nullable = false)
    private int points;

    @Column(name = "due_date")
    private LocalDateTime dueDate;

    @Column(name = "is_published", nullable = false)
    private boolean published;

    @Lob
    @Column(name = "starter_code")
    private String starterCode;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false, nullable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @OneToMany(mappedBy = "assignment", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("position ASC")
    private List<Question> questions = new ArrayList<>();

    @OneToMany(mappedBy = "assignment", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<AssignmentAttachment> attachments = new ArrayList<>();

    public Course getCourse() {
        return module.getCourse();
    }

    public void addQuestion(Question question) {
        question.setAssignment(this);
        question.setPosition(questions.size());
        questions.add(question);
    }

    public void removeQuestion(Question question) {
        questions.remove(question);
        question.setAssignment(null);
        for (int i = 0; i < questions.size(); i++) {
            questions.get(i).setPosition(i);
        }
    }

    public void replaceQuestions(List<Question> replacement) {
        questions.clear();
        replacement.forEach(this::addQuestion);
    }

    public void addAttachment(AssignmentAttachment attachment) {
        attachment.setAssignment(this);
        attachments.add(attachment);
    }

    /**
     * Highest score a submission can reach: the question total for quizzes,
     * the flat point value for manually graded subtypes.
     */
    public int maxScore() {
        if (subtype == AssignmentSubtype.QUIZ_FORM) {
            return questions.stream().mapToInt(Question::getPoints).sum();
        }
        return points;
    }
}
