package uk.gegc.intellicode.features.assignment.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.mock.web.MockMultipartFile;
import uk.gegc.intellicode.BaseUnitTest;
import uk.gegc.intellicode.features.assignment.api.dto.*;
import uk.gegc.intellicode.features.assignment.config.AssignmentStorageProperties;
import uk.gegc.intellicode.features.assignment.domain.exception.UploadFailedException;
import uk.gegc.intellicode.features.assignment.domain.grading.EnumerationMatchMode;
import uk.gegc.intellicode.features.assignment.domain.model.*;
import uk.gegc.intellicode.features.assignment.domain.repository.AssignmentRepository;
import uk.gegc.intellicode.features.assignment.domain.repository.SubmissionRepository;
import uk.gegc.intellicode.features.assignment.domain.service.AssignmentError;
import uk.gegc.intellicode.features.assignment.domain.service.AssignmentFailure;
import uk.gegc.intellicode.features.assignment.infra.grading.*;
import uk.gegc.intellicode.features.assignment.infra.mapping.AssignmentMapper;
import uk.gegc.intellicode.features.assignment.infra.storage.AssignmentFileStorage;
import uk.gegc.intellicode.features.assignment.infra.storage.StoredObject;
import uk.gegc.intellicode.features.course.domain.model.Course;
import uk.gegc.intellicode.features.course.domain.model.CourseModule;
import uk.gegc.intellicode.features.course.domain.model.EnrollmentStatus;
import uk.gegc.intellicode.features.course.domain.repository.CourseModuleRepository;
import uk.gegc.intellicode.features.course.domain.repository.EnrollmentRepository;
import uk.gegc.intellicode.shared.exception.ErrorKind;
import uk.gegc.intellicode.shared.exception.StorageException;
import uk.gegc.intellicode.shared.result.Result;

import java.io.InputStream;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static uk.gegc.intellicode.features.assignment.infra.grading.QuestionFixtures.trueFalse;
import static uk.gegc.intellicode.features.assignment.infra.grading.QuestionFixtures.withAnswers;

class AssignmentServiceImplTest extends BaseUnitTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC);

    @Mock
    private AssignmentRepository assignmentRepository;
    @Mock
    private CourseModuleRepository moduleRepository;
    @Mock
    private SubmissionRepository submissionRepository;
    @Mock
    private EnrollmentRepository enrollmentRepository;
    @Mock
    private AssignmentFileStorage fileStorage;

    private AssignmentServiceImpl service;
    private UUID instructorId;
    private UUID studentId;
    private Course course;
    private CourseModule module;

    @BeforeEach
    void setUp() {
        QuestionGraderFactory graderFactory = new QuestionGraderFactory(List.of(
                new MultipleChoiceGrader(),
                new TrueFalseGrader(),
                new IdentificationGrader(),
                new EnumerationGrader(EnumerationMatchMode.COUNT_EVERY_MATCH)));
        service = new AssignmentServiceImpl(assignmentRepository, moduleRepository, submissionRepository,
                enrollmentRepository, graderFactory, fileStorage, new AssignmentStorageProperties(),
                new AssignmentMapper(), CLOCK);

        instructorId = UUID.randomUUID();
        studentId = UUID.randomUUID();
        course = new Course();
        course.setId(UUID.randomUUID());
        course.setTitle("Astronomy");
        course.setInstructorId(instructorId);
        module = new CourseModule();
        module.setId(UUID.randomUUID());
        module.setCourse(course);
        module.setTitle("The solar system");
    }

    private Assignment quiz() {
        Assignment assignment = new Assignment();
        assignment.setId(UUID.randomUUID());
        assignment.setModule(module);
        assignment.setTitle("Planets");
        assignment.setSubtype(AssignmentSubtype.QUIZ_FORM);
        assignment.setPublished(true);
        assignment.addQuestion(withAnswers(QuestionType.ENUMERATION, 9, "Mercury", "Venus", "Earth"));
        assignment.addQuestion(trueFalse(true, 1));
        return assignment;
    }

    private void saveAssignsIds() {
        when(assignmentRepository.saveAndFlush(any(Assignment.class))).thenAnswer(inv -> {
            Assignment a = inv.getArgument(0);
            if (a.getId() == null) {
                a.setId(UUID.randomUUID());
            }
            a.getQuestions().stream().filter(q -> q.getId() == null).forEach(q -> q.setId(UUID.randomUUID()));
            a.getAttachments().stream().filter(f -> f.getId() == null).forEach(f -> f.setId(UUID.randomUUID()));
            return a;
        });
    }

    private static QuestionRequest enumeration(String... answers) {
        return new QuestionRequest("Name the inner planets", QuestionType.ENUMERATION, 9, null,
                List.of(answers), null, "Closest first", null, null);
    }

    private static CreateAssignmentRequest createQuiz(List<QuestionRequest> questions) {
        return new CreateAssignmentRequest(" Planets ", "Inner planets", AssignmentSubtype.QUIZ_FORM, 0,
                null, null, "print(1)", questions);
    }

    private void owned(Assignment assignment) {
        when(assignmentRepository.findWithCourseById(assignment.getId())).thenReturn(Optional.of(assignment));
    }

    @Nested
    @DisplayName("createAssignment")
    class Create {

        @Test
        @DisplayName("stores the questions in order and returns the answer key to the instructor")
        void createsQuiz() {
            when(moduleRepository.findWithCourseById(module.getId())).thenReturn(Optional.of(module));
            saveAssignsIds();
            QuestionRequest sunIsStar = new QuestionRequest("The sun is a star", QuestionType.TRUE_FALSE, 1,
                    null, null, null, null, null, true);

            Result<AssignmentDto, AssignmentFailure> result = service.createAssignment(module.getId(), instructorId,
                    createQuiz(List.of(enumeration("Mercury", "Venus", "Earth"), sunIsStar)), null);

            assertThat(result.isOk()).isTrue();
            AssignmentDto dto = result.getValue();
            assertThat(dto.title()).isEqualTo("Planets");
            assertThat(dto.published()).isTrue();
            assertThat(dto.maxScore()).isEqualTo(10);
            assertThat(dto.starterCode()).isNull();
            assertThat(dto.questions()).extracting(QuestionDto::position).containsExactly(0, 1);
            assertThat(dto.questions().get(0).correctAnswers()).containsExactly("Mercury", "Venus", "Earth");
            assertThat(dto.questions().get(1).isTrue()).isTrue();
            verifyNoInteractions(fileStorage);
        }

        @Test
        @DisplayName("module of another instructor is not found")
        void moduleNotOwned() {
            when(moduleRepository.findWithCourseById(module.getId())).thenReturn(Optional.of(module));

            Result<AssignmentDto, AssignmentFailure> result = service.createAssignment(module.getId(),
                    UUID.randomUUID(), createQuiz(List.of()), null);

            assertThat(result.getError().error()).isEqualTo(AssignmentError.MODULE_NOT_FOUND);
            verify(assignmentRepository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("a question without an answer key is rejected before anything is stored")
        void incompleteQuestion() {
            when(moduleRepository.findWithCourseById(module.getId())).thenReturn(Optional.of(module));
            QuestionRequest noKey = new QuestionRequest("Capital of France?", QuestionType.IDENTIFICATION, 1,
                    "  ", null, null, null, null, null);

            Result<AssignmentDto, AssignmentFailure> result = service.createAssignment(module.getId(), instructorId,
                    createQuiz(List.of(enumeration("a"), noKey)), null);

            assertThat(result.getError().error()).isEqualTo(AssignmentError.INVALID_QUESTION);
            assertThat(result.getError().message()).startsWith("Question 2 (IDENTIFICATION)");
            assertThat(result.getError().toException().getKind()).isEqualTo(ErrorKind.VALIDATION);
            verify(assignmentRepository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("starter code is kept for code sandbox assignments")
        void starterCode() {
            when(moduleRepository.findWithCourseById(module.getId())).thenReturn(Optional.of(module));
            saveAssignsIds();
            CreateAssignmentRequest request = new CreateAssignmentRequest("Fizz buzz", null,
                    AssignmentSubtype.CODE_SANDBOX, 10, null, false, "def fizz():\n    pass", null);

            AssignmentDto dto = service.createAssignment(module.getId(), instructorId, request, null).getValue();

            assertThat(dto.starterCode()).isEqualTo("def fizz():\n    pass");
            assertThat(dto.published()).isFalse();
            assertThat(dto.maxScore()).isEqualTo(10);
        }

        @Test
        @DisplayName("attachment is stored under the attachment prefix and recorded")
        void withAttachment() {
            when(moduleRepository.findWithCourseById(module.getId())).thenReturn(Optional.of(module));
            saveAssignsIds();
            when(fileStorage.store(anyString(), any(InputStream.class), anyLong(), anyString()))
                    .thenAnswer(inv -> new StoredObject(inv.getArgument(0), "https://files.test/" + inv.getArgument(0)));
            MockMultipartFile brief = new MockMultipartFile("attachment", "brief.pdf", "application/pdf", new byte[]{1, 2});

            AssignmentDto dto = service.createAssignment(module.getId(), instructorId,
                    createQuiz(List.of(enumeration("a"))), brief).getValue();

            assertThat(dto.attachments()).singleElement().satisfies(a -> {
                assertThat(a.originalName()).isEqualTo("brief.pdf");
                assertThat(a.fileType()).isEqualTo(StoredFileType.PDF);
                assertThat(a.size()).isEqualTo(2);
                assertThat(a.publicUrl()).contains("assignment-attachments/" + dto.id() + "/");
            });
            verify(assignmentRepository, times(2)).saveAndFlush(any(Assignment.class));
        }

        @Test
        @DisplayName("oversized attachment is rejected before the assignment is written")
        void attachmentTooLarge() {
            when(moduleRepository.findWithCourseById(module.getId())).thenReturn(Optional.of(module));
            AssignmentStorageProperties properties = new AssignmentStorageProperties();
            properties.setMaxFileSizeBytes(1);
            service = new AssignmentServiceImpl(assignmentRepository, moduleRepository, submissionRepository,
                    enrollmentRepository, new QuestionGraderFactory(List.of(new TrueFalseGrader())), fileStorage,
                    properties, new AssignmentMapper(), CLOCK);
            MockMultipartFile brief = new MockMultipartFile("attachment", "brief.pdf", "application/pdf", new byte[]{1, 2});

            Result<AssignmentDto, AssignmentFailure> result = service.createAssignment(module.getId(), instructorId,
                    createQuiz(List.of()), brief);

            assertThat(result.getError().error()).isEqualTo(AssignmentError.ATTACHMENT_TOO_LARGE);
            verifyNoInteractions(fileStorage);
            verify(assignmentRepository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("storage failure throws so the assignment is rolled back")
        void storageFailure() {
            when(moduleRepository.findWithCourseById(module.getId())).thenReturn(Optional.of(module));
            saveAssignsIds();
            when(fileStorage.store(anyString(), any(InputStream.class), anyLong(), anyString()))
                    .thenThrow(new StorageException("bucket unavailable", new RuntimeException("io")));
            MockMultipartFile brief = new MockMultipartFile("attachment", "brief.pdf", "application/pdf", new byte[]{1});

            assertThatThrownBy(() -> service.createAssignment(module.getId(), instructorId,
                    createQuiz(List.of()), brief))
                    .isInstanceOf(UploadFailedException.class)
                    .hasMessageContaining("bucket unavailable");
            verify(fileStorage, never()).delete(anyString());
        }

        @Test
        @DisplayName("stored attachment is deleted when its row cannot be written")
        void rowWriteFailure() {
            when(moduleRepository.findWithCourseById(module.getId())).thenReturn(Optional.of(module));
            when(assignmentRepository.saveAndFlush(any(Assignment.class)))
                    .thenAnswer(inv -> {
                        Assignment a = inv.getArgument(0);
                        a.setId(UUID.randomUUID());
                        return a;
                    })
                    .thenThrow(new DataIntegrityViolationException("value too long for column"));
            when(fileStorage.store(anyString(), any(InputStream.class), anyLong(), anyString()))
                    .thenAnswer(inv -> new StoredObject(inv.getArgument(0), "https://files.test/" + inv.getArgument(0)));
            MockMultipartFile brief = new MockMultipartFile("attachment", "brief.pdf", "application/pdf", new byte[]{1});

            assertThatThrownBy(() -> service.createAssignment(module.getId(), instructorId,
                    createQuiz(List.of()), brief))
                    .isInstanceOf(UploadFailedException.class)
                    .hasMessageNotContaining("column");
            verify(fileStorage).delete(contains("brief.pdf"));
        }
    }

    @Nested
    @DisplayName("getAssignment")
    class Get {

        @Test
        @DisplayName("enrolled student sees the questions without the answer key")
        void studentViewHidesAnswers() {
            Assignment quiz = quiz();
            owned(quiz);
            when(enrollmentRepository.existsByCourseIdAndStudentIdAndStatus(course.getId(), studentId,
                    EnrollmentStatus.ACTIVE)).thenReturn(true);
            when(submissionRepository.countByAssignmentIdAndStudentId(quiz.getId(), studentId)).thenReturn(1L);

            AssignmentDto dto = service.getAssignment(quiz.getId(), studentId).getValue();

            assertThat(dto.alreadySubmitted()).isTrue();
            assertThat(dto.questions()).hasSize(2).allSatisfy(q -> {
                assertThat(q.correctAnswer()).isNull();
                assertThat(q.correctAnswers()).isEmpty();
                assertThat(q.isTrue()).isNull();
                assertThat(q.explanation()).isNull();
            });
        }

        @Test
        @DisplayName("instructor sees the answer key")
        void instructorViewShowsAnswers() {
            Assignment quiz = quiz();
            owned(quiz);

            AssignmentDto dto = service.getAssignment(quiz.getId(), instructorId).getValue();

            assertThat(dto.questions().get(0).correctAnswers()).containsExactly("Mercury", "Venus", "Earth");
            assertThat(dto.questions().get(1).isTrue()).isTrue();
            verifyNoInteractions(enrollmentRepository);
        }

        @Test
        @DisplayName("unpublished assignment is not found for students")
        void unpublished() {
            Assignment draft = quiz();
            draft.setPublished(false);
            owned(draft);

            Result<AssignmentDto, AssignmentFailure> result = service.getAssignment(draft.getId(), studentId);

            assertThat(result.getError().error()).isEqualTo(AssignmentError.ASSIGNMENT_NOT_FOUND);
        }

        @Test
        @DisplayName("student without an active enrollment gets not found")
        void notEnrolled() {
            Assignment quiz = quiz();
            owned(quiz);
            when(enrollmentRepository.existsByCourseIdAndStudentIdAndStatus(course.getId(), studentId,
                    EnrollmentStatus.ACTIVE)).thenReturn(false);

            assertThat(service.getAssignment(quiz.getId(), studentId).getError().error())
                    .isEqualTo(AssignmentError.ASSIGNMENT_NOT_FOUND);
        }

        @Test
        @DisplayName("module listing for students skips drafts and flags submitted ones")
        void moduleListing() {
            Assignment submitted = quiz();
            Assignment open = quiz();
            Assignment draft = quiz();
            draft.setPublished(false);
            when(moduleRepository.findWithCourseById(module.getId())).thenReturn(Optional.of(module));
            when(assignmentRepository.findAllByModuleIdOrderByCreatedAtAsc(module.getId()))
                    .thenReturn(List.of(submitted, open, draft));
            when(enrollmentRepository.existsByCourseIdAndStudentIdAndStatus(course.getId(), studentId,
                    EnrollmentStatus.ACTIVE)).thenReturn(true);
            when(submissionRepository.findSubmittedAssignmentIds(studentId, List.of(submitted.getId(), open.getId())))
                    .thenReturn(Set.of(submitted.getId()));

            List<AssignmentDto> listed = service.getModuleAssignments(module.getId(), studentId).getValue();

            assertThat(listed).extracting(AssignmentDto::id).containsExactly(submitted.getId(), open.getId());
            assertThat(listed).extracting(AssignmentDto::alreadySubmitted).containsExactly(true, false);
        }
    }

    @Nested
    @DisplayName("updating and deleting")
    class UpdateAndDelete {

        @Test
        @DisplayName("changes only the given fields")
        void partialUpdate() {
            Assignment quiz = quiz();
            owned(quiz);
            saveAssignsIds();
            UpdateAssignmentRequest request = new UpdateAssignmentRequest(" Inner planets ", null, null, null,
                    null, false, null, null);

            AssignmentDto dto = service.updateAssignment(quiz.getId(), instructorId, request).getValue();

            assertThat(dto.title()).isEqualTo("Inner planets");
            assertThat(dto.published()).isFalse();
            assertThat(dto.questions()).hasSize(2);
            verify(submissionRepository, never()).existsByAssignmentId(any());
        }

        @Test
        @DisplayName("questions cannot be replaced once students have submitted")
        void questionsLocked() {
            Assignment quiz = quiz();
            owned(quiz);
            when(submissionRepository.existsByAssignmentId(quiz.getId())).thenReturn(true);
            UpdateAssignmentRequest request = new UpdateAssignmentRequest(null, null, null, null, null, null, null,
                    List.of(enumeration("Mars")));

            Result<AssignmentDto, AssignmentFailure> result = service.updateAssignment(quiz.getId(), instructorId, request);

            assertThat(result.getError().error()).isEqualTo(AssignmentError.QUESTIONS_LOCKED);
            assertThat(result.getError().toException().getKind()).isEqualTo(ErrorKind.CONFLICT);
            assertThat(quiz.getQuestions()).hasSize(2);
        }

        @Test
        @DisplayName("subtype cannot change once students have submitted")
        void subtypeLocked() {
            Assignment quiz = quiz();
            owned(quiz);
            when(submissionRepository.existsByAssignmentId(quiz.getId())).thenReturn(true);
            UpdateAssignmentRequest request = new UpdateAssignmentRequest(null, null, AssignmentSubtype.FILE_UPLOAD,
                    null, null, null, null, null);

            assertThat(service.updateAssignment(quiz.getId(), instructorId, request).getError().error())
                    .isEqualTo(AssignmentError.SUBTYPE_LOCKED);
            assertThat(quiz.getSubtype()).isEqualTo(AssignmentSubtype.QUIZ_FORM);
        }

        @Test
        @DisplayName("another instructor cannot update")
        void notOwned() {
            Assignment quiz = quiz();
            owned(quiz);

            Result<AssignmentDto, AssignmentFailure> result = service.updateAssignment(quiz.getId(), UUID.randomUUID(),
                    new UpdateAssignmentRequest("x", null, null, null, null, null, null, null));

            assertThat(result.getError().error()).isEqualTo(AssignmentError.ASSIGNMENT_NOT_OWNED);
            assertThat(quiz.getTitle()).isEqualTo("Planets");
        }

        @Test
        @DisplayName("delete with submissions is a conflict")
        void deleteWithSubmissions() {
            Assignment quiz = quiz();
            owned(quiz);
            when(submissionRepository.existsByAssignmentId(quiz.getId())).thenReturn(true);

            Result<Void, AssignmentFailure> result = service.deleteAssignment(quiz.getId(), instructorId);

            assertThat(result.getError().error()).isEqualTo(AssignmentError.HAS_SUBMISSIONS);
            verify(assignmentRepository, never()).delete(any());
        }

        @Test
        @DisplayName("delete removes attached objects before the rows")
        void deleteRemovesAttachmentsFirst() {
            Assignment quiz = quiz();
            AssignmentAttachment brief = new AssignmentAttachment();
            brief.setStorageKey("assignment-attachments/brief.pdf");
            quiz.addAttachment(brief);
            owned(quiz);

            Result<Void, AssignmentFailure> result = service.deleteAssignment(quiz.getId(), instructorId);

            assertThat(result.isOk()).isTrue();
            InOrder order = inOrder(fileStorage, assignmentRepository);
            order.verify(fileStorage).delete("assignment-attachments/brief.pdf");
            order.verify(assignmentRepository).delete(quiz);
        }

        @Test
        @DisplayName("delete keeps the assignment when an attached object cannot be removed")
        void deleteCleanupFailure() {
            Assignment quiz = quiz();
            AssignmentAttachment brief = new AssignmentAttachment();
            brief.setStorageKey("assignment-attachments/brief.pdf");
            quiz.addAttachment(brief);
            owned(quiz);
            doThrow(new StorageException("denied", new RuntimeException())).when(fileStorage).delete(anyString());

            Result<Void, AssignmentFailure> result = service.deleteAssignment(quiz.getId(), instructorId);

            assertThat(result.getError().error()).isEqualTo(AssignmentError.ATTACHMENT_CLEANUP_FAILED);
            verify(assignmentRepository, never()).delete(any());
        }
    }

    @Nested
    @DisplayName("question editing")
    class Questions {

        @Test
        @DisplayName("added question goes last")
        void addQuestion() {
            Assignment quiz = quiz();
            owned(quiz);
            saveAssignsIds();

            QuestionDto dto = service.addQuestion(quiz.getId(), instructorId, enumeration("Mars")).getValue();

            assertThat(dto.id()).isNotNull();
            assertThat(dto.position()).isEqualTo(2);
            assertThat(quiz.maxScore()).isEqualTo(19);
        }

        @Test
        @DisplayName("updated question keeps its id and position")
        void updateQuestion() {
            Assignment quiz = quiz();
            Question first = quiz.getQuestions().get(0);
            owned(quiz);
            saveAssignsIds();

            QuestionDto dto = service.updateQuestion(quiz.getId(), first.getId(), instructorId,
                    enumeration("Mercury", "Venus")).getValue();

            assertThat(dto.id()).isEqualTo(first.getId());
            assertThat(dto.position()).isZero();
            assertThat(first.getCorrectAnswers()).containsExactly("Mercury", "Venus");
            assertThat(first.getExplanation()).isEqualTo("Closest first");
        }

        @Test
        @DisplayName("invalid update leaves the question untouched")
        void invalidUpdate() {
            Assignment quiz = quiz();
            Question first = quiz.getQuestions().get(0);
            owned(quiz);

            Result<QuestionDto, AssignmentFailure> result = service.updateQuestion(quiz.getId(), first.getId(),
                    instructorId, enumeration());

            assertThat(result.getError().error()).isEqualTo(AssignmentError.INVALID_QUESTION);
            assertThat(first.getCorrectAnswers()).containsExactly("Mercury", "Venus", "Earth");
        }

        @Test
        @DisplayName("deleting a question renumbers the rest")
        void deleteQuestion() {
            Assignment quiz = quiz();
            Question first = quiz.getQuestions().get(0);
            owned(quiz);
            saveAssignsIds();

            assertThat(service.deleteQuestion(quiz.getId(), first.getId(), instructorId).isOk()).isTrue();

            assertThat(quiz.getQuestions()).singleElement().satisfies(q -> {
                assertThat(q.getType()).isEqualTo(QuestionType.TRUE_FALSE);
                assertThat(q.getPosition()).isZero();
            });
        }

        @Test
        @DisplayName("unknown question is not found")
        void unknownQuestion() {
            Assignment quiz = quiz();
            owned(quiz);

            assertThat(service.deleteQuestion(quiz.getId(), UUID.randomUUID(), instructorId).getError().error())
                    .isEqualTo(AssignmentError.QUESTION_NOT_FOUND);
        }

        @Test
        @DisplayName("questions are locked once students have submitted")
        void locked() {
            Assignment quiz = quiz();
            owned(quiz);
            when(submissionRepository.existsByAssignmentId(quiz.getId())).thenReturn(true);

            assertThat(service.addQuestion(quiz.getId(), instructorId, enumeration("Mars")).getError().error())
                    .isEqualTo(AssignmentError.QUESTIONS_LOCKED);
            assertThat(quiz.getQuestions()).hasSize(2);
        }
    }
}
