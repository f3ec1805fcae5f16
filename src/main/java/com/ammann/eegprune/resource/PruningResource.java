/* (C)2026 */
package com.ammann.eegprune.resource;

import com.ammann.eegprune.config.PruningConfig;
import com.ammann.eegprune.dto.PruningResultDTO;
import com.ammann.eegprune.dto.RecordingRequestDTO;
import com.ammann.eegprune.model.PruningOptions;
import com.ammann.eegprune.model.PruningResult;
import com.ammann.eegprune.model.Recording;
import com.ammann.eegprune.properties.ApiProperties;
import com.ammann.eegprune.service.PruningPipelineService;
import com.ammann.eegprune.service.RecordingMappingService;
import com.ammann.eegprune.service.ReportExportService;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource for pruning EEG recordings.
 *
 * <p>Accepts a recording with its events, removes invalid data and unwanted sleep stages,
 * and returns the pruned events together with the reconciliation report. The report can
 * also be downloaded as CSV.
 */
@Path(ApiProperties.BASE_URL_V1)
@Tag(name = "Pruning API", description = "Event-aware segment rejection for EEG recordings")
@Consumes(MediaType.APPLICATION_JSON)
public class PruningResource {

    private static final Logger LOG = Logger.getLogger(PruningResource.class);

    static final String TEXT_CSV = "text/csv";

    @Inject PruningPipelineService pipeline;

    @Inject RecordingMappingService mapper;

    @Inject ReportExportService exporter;

    @Inject PruningConfig config;

    @POST
    @Path(ApiProperties.Recordings.PRUNE)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Prune Recording",
            description =
                    "Removes invalid-data segments and unwanted sleep stages, relocating"
                            + " stimulation events out of removed data first.")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Recording pruned",
                content = @Content(schema = @Schema(implementation = PruningResultDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid recording or options"),
        @APIResponse(responseCode = "422", description = "A pipeline step failed"),
        @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public Response prune(@Valid @NotNull RecordingRequestDTO request) {
        PruningResult result = run(request);
        boolean includeData = Boolean.TRUE.equals(request.includeData());
        return Response.ok(mapper.toResponse(result, includeData)).build();
    }

    @POST
    @Path(ApiProperties.Recordings.PRUNE_REPORT_CSV)
    @Produces(TEXT_CSV)
    @Operation(
            summary = "Prune Recording and Export Report",
            description = "Prunes the recording and returns the reconciliation report as CSV.")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Reconciliation report as CSV"),
        @APIResponse(responseCode = "400", description = "Invalid recording or options"),
        @APIResponse(responseCode = "422", description = "A pipeline step failed"),
        @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public Response pruneReportCsv(@Valid @NotNull RecordingRequestDTO request) {
        PruningResult result = run(request);
        String csv = exporter.toCsv(result.report());
        return Response.ok(csv, TEXT_CSV)
                .header(
                        "Content-Disposition",
                        "attachment; filename=\"" + request.recordingId() + "_stim_report.csv\"")
                .build();
    }

    private PruningResult run(RecordingRequestDTO request) {
        LOG.debugf(
                "Prune request: recording=%s, channels=%d",
                request.recordingId(), request.channels().size());
        PruningOptions options = config.merge(request.options());
        Recording recording = mapper.toRecording(request);
        return pipeline.run(recording, options);
    }
}
