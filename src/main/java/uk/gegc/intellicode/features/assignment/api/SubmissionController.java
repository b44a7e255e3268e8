package uk.gegc.intellicode.features.assignment.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import uk.gegc.intellicode.features.assignment.api.dto.*;
import uk.gegc.intellicode.features.assignment.application.SubmissionService;
import uk.gegc.intellicode.features.assignment.domain.service.SubmissionFailure;
import uk.gegc.intellicode.features.auth.infra.security.AuthenticatedUser;
import uk.gegc.intellicode.shared.result.Result;

import java.util.List;
import java.util.UUID;

@Tag(name = "Submissions", description = "Submitting, grading and resetting assignment submissions")
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Validated
@SecurityRequirement(name = "bearerAuth")
public class SubmissionController {

    private final SubmissionService submissionService;

    @Operation(summary = "Submit quiz answers",
            description = "Grades the answers immediately. One submission per student and assignment.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Submission graded and stored",
                    content = @Content(schema = @Schema(implementation = SubmissionDto.class))),
            @ApiResponse(responseCode = "400", description = "Unknown question or wrong assignment type",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Not enrolled in the course",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Assignment not found or not published",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Already submitted",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/assignments/{assignmentId}/submissions")
    @PreAuthorize("hasRole('STUDENT')")
    public ResponseEntity<SubmissionDto> submitAnswers(
            @Parameter(description = "Assignment UUID", required = true) @PathVariable UUID assignmentId,
            @RequestBody @Valid SubmitAnswersRequest request,
            @AuthenticationPrincipal AuthenticatedUser user
    ) {
        SubmissionDto dto = unwrap(submissionService.submitAnswers(assignmentId, user.id(), request));
        return ResponseEntity.status(HttpStatus.CREATED).body(dto);
    }

    @Operation(summary = "Submit files for a file upload assignment")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Files stored",
                    content = @Content(schema = @Schema(implementation = SubmissionDto.class))),
            @ApiResponse(responseCode = "400", description = "No files or wrong assignment type",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "503", description = "Upload failed; nothing was kept",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping(value = "/assignments/{assignmentId}/submissions/files", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @PreAuthorize("hasRole('STUDENT')")
    public ResponseEntity<SubmissionDto> submitFiles(
            @PathVariable UUID assignmentId,
            @RequestPart(value = "files", required = false) List<MultipartFile> files,
            @AuthenticationPrincipal AuthenticatedUser user
    ) {
        SubmissionDto dto = unwrap(submissionService.submitFiles(assignmentId, user.id(), files));
        return ResponseEntity.status(HttpStatus.CREATED).body(dto);
    }

    @Operation(summary = "Submit source code for a code sandbox assignment")
    @PostMapping("/assignments/{assignmentId}/submissions/code")
    @PreAuthorize("hasRole('STUDENT')")
    public ResponseEntity<SubmissionDto> submitCode(
            @PathVariable UUID assignmentId,
            @RequestBody @Valid SubmitCodeRequest request,
            @AuthenticationPrincipal AuthenticatedUser user
    ) {
        SubmissionDto dto = unwrap(submissionService.submitCode(assignmentId, user.id(), request));
        return ResponseEntity.status(HttpStatus.CREATED).body(dto);
    }

    @Operation(summary = "List the caller's own submissions for an assignment")
    @ApiResponse(responseCode = "200", description = "Submissions, newest first",
            content = @Content(array = @ArraySchema(schema = @Schema(implementation = SubmissionDto.class))))
    @GetMapping("/assignments/{assignmentId}/submissions/me")
    public ResponseEntity<List<SubmissionDto>> getOwnSubmissions(
            @PathVariable UUID assignmentId,
            @AuthenticationPrincipal AuthenticatedUser user
    ) {
        return ResponseEntity.ok(submissionService.getOwnSubmissions(assignmentId, user.id()));
    }

    @Operation(summary = "List all submissions of an assignment for grading",
            description = "Only the instructor of the assignment's course may call this.")
    @GetMapping("/assignments/{assignmentId}/submissions")
    @PreAuthorize("hasRole('TEACHER')")
    public ResponseEntity<List<SubmissionForGradingDto>> getSubmissionsForGrading(
            @PathVariable UUID assignmentId,
            @AuthenticationPrincipal AuthenticatedUser user
    ) {
        return ResponseEntity.ok(unwrap(submissionService.getSubmissionsForGrading(assignmentId, user.id())));
    }

    @Operation(summary = "List student scores for an assignment")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Scores with percentages",
                    content = @Content(array = @ArraySchema(schema = @Schema(implementation = StudentScoreDto.class)))),
            @ApiResponse(responseCode = "404", description = "Assignment not found or not owned by the caller",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/assignments/{assignmentId}/scores")
    @PreAuthorize("hasRole('TEACHER')")
    public ResponseEntity<List<StudentScoreDto>> getStudentScores(
            @PathVariable UUID assignmentId,
            @AuthenticationPrincipal AuthenticatedUser user
    ) {
        return ResponseEntity.ok(unwrap(submissionService.getStudentScores(assignmentId, user.id())));
    }

    @Operation(summary = "Manually grade a submission")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Grade applied",
                    content = @Content(schema = @Schema(implementation = SubmissionDto.class))),
            @ApiResponse(responseCode = "400", description = "Score outside 0..max score",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Submission not found or not gradable by the caller",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PatchMapping("/submissions/{submissionId}/grade")
    @PreAuthorize("hasRole('TEACHER')")
    public ResponseEntity<SubmissionDto> gradeSubmission(
            @PathVariable UUID submissionId,
            @RequestBody @Valid ManualGradeRequest request,
            @AuthenticationPrincipal AuthenticatedUser user
    ) {
        return ResponseEntity.ok(unwrap(submissionService.gradeSubmission(submissionId, user.id(), request)));
    }

    @Operation(summary = "Undo a submission",
            description = "Instructors may reset any submission in their course. Students may remove their own "
                    + "ungraded file upload submission.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Submission removed",
                    content = @Content(schema = @Schema(implementation = UndoSubmissionResponse.class))),
            @ApiResponse(responseCode = "403", description = "Not allowed to remove this submission",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "422", description = "Submission is graded or of the wrong type",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "503", description = "Stored files could not be removed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @DeleteMapping("/assignments/{assignmentId}/submissions/{studentId}")
    public ResponseEntity<UndoSubmissionResponse> undoSubmission(
            @PathVariable UUID assignmentId,
            @PathVariable UUID studentId,
            @AuthenticationPrincipal AuthenticatedUser user
    ) {
        return ResponseEntity.ok(unwrap(
                submissionService.undoSubmission(assignmentId, studentId, user.id(), user.isTeacher())));
    }

    private static <T> T unwrap(Result<T, SubmissionFailure> result) {
        return result.orElseThrow(SubmissionFailure::toException);
    }
}
