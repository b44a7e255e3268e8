package uk.gegc.intellicode.features.assignment.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;
import uk.gegc.intellicode.features.assignment.api.dto.*;
import uk.gegc.intellicode.features.assignment.application.SubmissionService;
import uk.gegc.intellicode.features.assignment.config.AssignmentStorageProperties;
import uk.gegc.intellicode.features.assignment.domain.exception.DuplicateSubmissionException;
import uk.gegc.intellicode.features.assignment.domain.exception.UploadFailedException;
import uk.gegc.intellicode.features.assignment.domain.grading.AnswerInput;
import uk.gegc.intellicode.features.assignment.domain.grading.GradedAnswer;
import uk.gegc.intellicode.features.assignment.domain.grading.GradingOutcome;
import uk.gegc.intellicode.features.assignment.domain.model.*;
import uk.gegc.intellicode.features.assignment.domain.repository.AssignmentRepository;
import uk.gegc.intellicode.features.assignment.domain.repository.SubmissionRepository;
import uk.gegc.intellicode.features.assignment.domain.service.*;
import uk.gegc.intellicode.features.assignment.infra.mapping.SubmissionMapper;
import uk.gegc.intellicode.features.assignment.infra.storage.StoredObject;
import uk.gegc.intellicode.features.assignment.infra.storage.UploadNames;
import uk.gegc.intellicode.features.assignment.infra.storage.AssignmentFileStorage;
import uk.gegc.intellicode.features.course.domain.model.EnrollmentStatus;
import uk.gegc.intellicode.features.course.domain.repository.EnrollmentRepository;
import uk.gegc.intellicode.features.user.domain.model.User;
import uk.gegc.intellicode.features.user.domain.repository.UserRepository;
import uk.gegc.intellicode.shared.exception.StorageException;
import uk.gegc.intellicode.shared.result.Result;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class SubmissionServiceImpl implements SubmissionService {

    private final AssignmentRepository assignmentRepository;
    private final SubmissionRepository submissionRepository;
    private final EnrollmentRepository enrollmentRepository;
    private final UserRepository userRepository;
    private final GradingService gradingService;
    private final SubmissionStateMachine stateMachine;
    private final AssignmentFileStorage fileStorage;
    private final AssignmentStorageProperties storageProperties;
    private final SubmissionMapper submissionMapper;
    @Qualifier("utcClock")
    private final Clock utcClock;

    @Override
    @Transactional
    public Result<SubmissionDto, SubmissionFailure> submitAnswers(UUID assignmentId, UUID studentId,
                                                                  SubmitAnswersRequest request) {
        List<AnswerInput> inputs = request.answers().stream()
                .map(a -> new AnswerInput(a.questionId(), a.answerText()))
                .toList();

        return loadSubmittable(assignmentId, studentId, AssignmentSubtype.QUIZ_FORM)
                .flatMap(assignment -> gradingService.grade(assignment, inputs)
                        .map(outcome -> recordQuiz(assignment, studentId, outcome)));
    }

    @Override
    @Transactional
    public Result<SubmissionDto, SubmissionFailure> submitFiles(UUID assignmentId, UUID studentId,
                                                                List<MultipartFile> files) {
        Result<Assignment, SubmissionFailure> loaded =
                loadSubmittable(assignmentId, studentId, AssignmentSubtype.FILE_UPLOAD);
        if (loaded.isErr()) {
            return Result.err(loaded.getError());
        }
        Assignment assignment = loaded.getValue();

        List<MultipartFile> uploads = files == null ? List.of()
                : files.stream().filter(f -> f != null && !f.isEmpty()).toList();
        if (uploads.isEmpty()) {
            return Result.err(SubmissionFailure.of(SubmissionError.NO_FILES,
                    "At least one file must be uploaded for file upload assignments"));
        }
        for (MultipartFile file : uploads) {
            if (file.getSize() > storageProperties.getMaxFileSizeBytes()) {
                return Result.err(SubmissionFailure.of(SubmissionError.FILE_TOO_LARGE,
                        "File " + UploadNames.displayName(file.getOriginalFilename()) + " exceeds the maximum size of "
                                + storageProperties.getMaxFileSizeBytes() + " bytes"));
            }
        }

        Submission submission = insert(newSubmission(assignment, studentId, assignment.getPoints()));

        List<String> storedKeys = new ArrayList<>();
        try {
            for (MultipartFile file : uploads) {
                String key = objectKey(submission.getId(), file.getOriginalFilename());
                try (InputStream content = file.getInputStream()) {
                    StoredObject stored = fileStorage.store(key, content, file.getSize(),
                            UploadNames.contentType(file.getContentType()));
                    storedKeys.add(stored.key());
                    submission.addFile(toSubmissionFile(file, stored));
                }
            }
            Submission saved = submissionRepository.saveAndFlush(submission);
            log.info("Student {} submitted {} file(s) for assignment {}", studentId, uploads.size(), assignmentId);
            return Result.ok(submissionMapper.toDto(saved));
        } catch (StorageException | IOException | DataAccessException ex) {
            log.error("Upload for submission {} failed after {} stored object(s), rolling back submission",
                    submission.getId(), storedKeys.size(), ex);
            discardStoredObjects(submission.getId(), storedKeys);
            String message = ex instanceof DataAccessException
                    ? "Uploaded files could not be recorded; the submission was not saved"
                    : "Failed to upload submission file: " + ex.getMessage();
            throw new UploadFailedException(SubmissionError.UPLOAD_FAILED.name(), message, ex);
        }
    }

    @Override
    @Transactional
    public Result<SubmissionDto, SubmissionFailure> submitCode(UUID assignmentId, UUID studentId,
                                                               SubmitCodeRequest request) {
        if (isBlank(request.code()) || isBlank(request.language())) {
            return Result.err(SubmissionFailure.of(SubmissionError.MISSING_CODE));
        }

        return loadSubmittable(assignmentId, studentId, AssignmentSubtype.CODE_SANDBOX)
                .map(assignment -> {
                    Submission submission = newSubmission(assignment, studentId, assignment.getPoints());
                    submission.setSubmittedCode(request.code());
                    submission.setCodeLanguage(request.language().trim());
                    Submission saved = insert(submission);
                    log.info("Student {} submitted {} code for assignment {}", studentId, saved.getCodeLanguage(), assignmentId);
                    return submissionMapper.toDto(saved);
                });
    }

    @Override
    @Transactional(readOnly = true)
    public List<SubmissionDto> getOwnSubmissions(UUID assignmentId, UUID studentId) {
        return submissionRepository.findAllByAssignmentIdAndStudentIdOrderBySubmittedAtDesc(assignmentId, studentId)
                .stream()
                .map(submissionMapper::toDto)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Result<List<StudentScoreDto>, SubmissionFailure> getStudentScores(UUID assignmentId, UUID instructorId) {
        return loadOwnedAssignment(assignmentId, instructorId,
                "Assignment not found or you do not have permission to view scores")
                .map(assignment -> {
                    List<Submission> submissions =
                            submissionRepository.findAllByAssignmentIdOrderBySubmittedAtDesc(assignmentId);
                    Map<UUID, User> students = loadStudents(submissions);
                    return submissions.stream()
                            .map(s -> submissionMapper.toScoreDto(s, students.get(s.getStudentId())))
                            .toList();
                });
    }

    @Override
    @Transactional(readOnly = true)
    public Result<List<SubmissionForGradingDto>, SubmissionFailure> getSubmissionsForGrading(UUID assignmentId,
                                                                                             UUID instructorId) {
        return loadOwnedAssignment(assignmentId, instructorId,
                "Assignment not found or you do not have permission to view submissions")
                .map(assignment -> {
                    List<Submission> submissions =
                            submissionRepository.findAllByAssignmentIdOrderBySubmittedAtDesc(assignmentId);
                    Map<UUID, User> students = loadStudents(submissions);
                    return submissions.stream()
                            .map(s -> submissionMapper.toGradingDto(s, assignment.getTitle(), students.get(s.getStudentId())))
                            .toList();
                });
    }

    @Override
    @Transactional
    public Result<SubmissionDto, SubmissionFailure> gradeSubmission(UUID submissionId, UUID instructorId,
                                                                    ManualGradeRequest request) {
        Optional<Submission> found = submissionRepository.findById(submissionId)
                .filter(s -> assignmentRepository.findWithCourseById(s.getAssignmentId())
                        .map(a -> a.getCourse().isOwnedBy(instructorId))
                        .orElse(false));
        if (found.isEmpty()) {
            return Result.err(SubmissionFailure.of(SubmissionError.SUBMISSION_NOT_FOUND));
        }

        return stateMachine.applyGrade(found.get(), request.score(), request.feedback(),
                        request.markAsGraded(), LocalDateTime.now(utcClock))
                .map(graded -> {
                    Submission saved = submissionRepository.save(graded);
                    log.info("Instructor {} graded submission {}: {}/{} ({})",
                            instructorId, submissionId, saved.getScore(), saved.getMaxScore(), saved.getStatus());
                    return submissionMapper.toDto(saved);
                });
    }

    @Override
    @Transactional
    public Result<UndoSubmissionResponse, SubmissionFailure> undoSubmission(UUID assignmentId, UUID studentId,
                                                                            UUID actorId, boolean actingAsTeacher) {
        Optional<Assignment> found = assignmentRepository.findWithCourseById(assignmentId);
        if (found.isEmpty()) {
            return Result.err(SubmissionFailure.of(SubmissionError.ASSIGNMENT_NOT_FOUND, "Assignment not found"));
        }
        Assignment assignment = found.get();
        UndoActor actor = new UndoActor(actorId, actingAsTeacher, assignment.getCourse().isOwnedBy(actorId));
        Submission submission = submissionRepository.findByAssignmentIdAndStudentId(assignmentId, studentId)
                .orElse(null);

        Result<Void, SubmissionFailure> allowed =
                stateMachine.checkUndo(submission, assignment.getSubtype(), studentId, actor);
        if (allowed.isErr()) {
            return Result.err(allowed.getError());
        }

        // stored objects go first: if one cannot be removed the rows are kept and the undo can be retried
        List<String> failedKeys = new ArrayList<>();
        for (SubmissionFile file : submission.getFiles()) {
            try {
                fileStorage.delete(file.getStorageKey());
            } catch (StorageException ex) {
                log.error("Failed to delete stored file {} of submission {}", file.getStorageKey(), submission.getId(), ex);
                failedKeys.add(file.getStorageKey());
            }
        }
        if (!failedKeys.isEmpty()) {
            return Result.err(SubmissionFailure.of(SubmissionError.STORAGE_FAILURE,
                    "Could not remove " + failedKeys.size() + " of " + submission.getFiles().size()
                            + " stored files; the submission was kept. Please retry."));
        }

        submissionRepository.delete(submission);
        submissionRepository.flush();
        log.info("Submission {} for assignment {} removed by {}", submission.getId(), assignmentId, actorId);

        String message = actingAsTeacher
                ? "Submission for student " + studentId
                + " has been successfully reset. The student can now resubmit the assignment."
                : "Your submission has been successfully removed. You can now resubmit the assignment.";
        return Result.ok(new UndoSubmissionResponse(true, message));
    }

    private Result<Assignment, SubmissionFailure> loadSubmittable(UUID assignmentId, UUID studentId,
                                                                  AssignmentSubtype expectedSubtype) {
        Optional<Assignment> found = assignmentRepository.findPublishedWithQuestionsById(assignmentId);
        if (found.isEmpty()) {
            return Result.err(SubmissionFailure.of(SubmissionError.ASSIGNMENT_NOT_FOUND));
        }
        Assignment assignment = found.get();

        if (!enrollmentRepository.existsByCourseIdAndStudentIdAndStatus(
                assignment.getCourse().getId(), studentId, EnrollmentStatus.ACTIVE)) {
            return Result.err(SubmissionFailure.of(SubmissionError.NOT_ENROLLED));
        }
        if (assignment.getSubtype() != expectedSubtype) {
            return Result.err(SubmissionFailure.of(SubmissionError.WRONG_SUBTYPE,
                    "This endpoint only accepts " + expectedSubtype + " assignments; this assignment is "
                            + assignment.getSubtype()));
        }

        SubmissionState current = SubmissionState.of(
                submissionRepository.findByAssignmentIdAndStudentId(assignmentId, studentId).orElse(null));
        return stateMachine.checkSubmit(current).map(ignored -> assignment);
    }

    private Result<Assignment, SubmissionFailure> loadOwnedAssignment(UUID assignmentId, UUID instructorId,
                                                                      String notFoundMessage) {
        return assignmentRepository.findWithCourseById(assignmentId)
                .filter(a -> a.getCourse().isOwnedBy(instructorId))
                .<Result<Assignment, SubmissionFailure>>map(Result::ok)
                .orElseGet(() -> Result.err(SubmissionFailure.of(SubmissionError.ASSIGNMENT_NOT_OWNED, notFoundMessage)));
    }

    private SubmissionDto recordQuiz(Assignment assignment, UUID studentId, GradingOutcome outcome) {
        Submission submission = newSubmission(assignment, studentId, outcome.maxScore());
        submission.setScore(outcome.score());
        for (GradedAnswer graded : outcome.answers()) {
            SubmissionAnswer answer = new SubmissionAnswer();
            answer.setQuestionId(graded.result().questionId());
            answer.setAnswerText(graded.answerText());
            answer.setCorrect(graded.result().correct());
            answer.setPointsEarned(graded.result().pointsEarned());
            submission.addAnswer(answer);
        }
        Submission saved = insert(submission);
        log.info("Student {} submitted assignment {}: {}/{}", studentId, assignment.getId(),
                saved.getScore(), saved.getMaxScore());
        return submissionMapper.toDto(saved);
    }

    private Submission newSubmission(Assignment assignment, UUID studentId, int maxScore) {
        Submission submission = new Submission();
        submission.setAssignmentId(assignment.getId());
        submission.setStudentId(studentId);
        submission.setMaxScore(maxScore);
        submission.setScore(0);
        submission.setStatus(SubmissionStatus.SUBMITTED);
        submission.setSubmittedAt(LocalDateTime.now(utcClock));
        return submission;
    }

    private Submission insert(Submission submission) {
        try {
            return submissionRepository.saveAndFlush(submission);
        } catch (DataIntegrityViolationException ex) {
            log.warn("Concurrent submission detected for assignment {} and student {}",
                    submission.getAssignmentId(), submission.getStudentId());
            throw new DuplicateSubmissionException(ex);
        }
    }

    private void discardStoredObjects(UUID submissionId, List<String> storedKeys) {
        for (String key : storedKeys) {
            try {
                fileStorage.delete(key);
            } catch (StorageException ex) {
                log.error("Orphaned object {} left in storage after failed submission {}", key, submissionId, ex);
            }
        }
    }

    private Map<UUID, User> loadStudents(List<Submission> submissions) {
        Set<UUID> ids = submissions.stream().map(Submission::getStudentId).collect(Collectors.toSet());
        return userRepository.findAllById(ids).stream()
                .collect(Collectors.toMap(User::getId, Function.identity()));
    }

    private SubmissionFile toSubmissionFile(MultipartFile file, StoredObject stored) {
        SubmissionFile submissionFile = new SubmissionFile();
        submissionFile.setOriginalName(UploadNames.displayName(file.getOriginalFilename()));
        submissionFile.setMimeType(UploadNames.contentType(file.getContentType()));
        submissionFile.setFileType(StoredFileType.fromMimeType(submissionFile.getMimeType()));
        submissionFile.setSize(file.getSize());
        submissionFile.setStorageKey(stored.key());
        submissionFile.setPublicUrl(stored.publicUrl());
        submissionFile.setUploadedAt(LocalDateTime.now(utcClock));
        return submissionFile;
    }

    private String objectKey(UUID submissionId, String originalFilename) {
        return storageProperties.getKeyPrefix() + "/" + submissionId + "/" + UUID.randomUUID() + "-"
                + UploadNames.keyName(originalFilename);
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
