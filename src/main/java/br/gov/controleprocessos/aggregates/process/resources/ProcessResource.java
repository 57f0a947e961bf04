package br.gov.controleprocessos.aggregates.process.resources;

import br.gov.controleprocessos.aggregates.process.exceptions.ProcessNotFoundException;
import br.gov.controleprocessos.aggregates.process.model.enums.Department;
import br.gov.controleprocessos.aggregates.process.services.ProcessTrackingService;
import br.gov.controleprocessos.aggregates.process.services.dto.*;
import br.gov.controleprocessos.exceptions.ProcessRejectedExceptionMapper;
import jakarta.enterprise.context.RequestScoped;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.util.List;
import java.util.Map;

/**
 * REST adapter over {@link ProcessTrackingService}.
 *
 * Creations and transitions answer with the {@link TransitionResult}: 200 (201 for
 * creations) when accepted, and 400 / 404 / 409 with the rejection when not.
 */
@Path("/api/processes")
@RequestScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@Tag(name = "processes", description = "Process lifecycle and history")
public class ProcessResource {

    @Inject
    ProcessTrackingService service;

    @POST
    @Operation(summary = "Create process", description = "Open a process instance in a department")
    public Response create(@Valid CreateProcessCommand command) {
        TransitionResult result = service.createInstance(command);
        if (!result.accepted()) {
            return rejected(result);
        }
        return Response.status(Response.Status.CREATED).entity(result).build();
    }

    @GET
    @Path("/{id}")
    @Operation(summary = "Get process", description = "Get a single process instance")
    public ProcessInstanceView findOne(@PathParam("id") String id) {
        return service.findInstance(id).orElseThrow(() -> ProcessNotFoundException.instance(id));
    }

    @DELETE
    @Path("/{id}")
    @Operation(summary = "Delete process", description = "Delete a process instance and its movement ledger")
    public Response delete(@PathParam("id") String id) {
        service.deleteInstance(id);
        return Response.noContent().build();
    }

    @POST
    @Path("/{id}/transitions")
    @Operation(summary = "Move process", description = "Apply a transfer, finalization, return, reassignment, edit or status change")
    public Response transition(@PathParam("id") String id, @Valid TransitionCommand command) {
        TransitionResult result = service.transition(id, command);
        if (!result.accepted()) {
            return rejected(result);
        }
        return Response.ok(result).build();
    }

    @GET
    @Path("/inspect")
    @Operation(summary = "Inspect case number", description = "Active and finalized processes sharing a case number, with prefill suggestion")
    public GroupInspection inspect(@QueryParam("caseNumber") String caseNumber) {
        return service.inspect(caseNumber);
    }

    @GET
    @Path("/{id}/timeline")
    @Operation(summary = "Process timeline", description = "Ordered history of the demand cycle the process belongs to")
    public List<TimelineEntry> timeline(@PathParam("id") String id) {
        return service.timeline(id);
    }

    @GET
    @Path("/{id}/legs")
    @Operation(summary = "Department legs", description = "Values of the demand cycle per department it went through")
    public List<DepartmentLeg> legs(@PathParam("id") String id) {
        return service.departmentLegs(id);
    }

    @GET
    @Path("/occupancy")
    @Operation(summary = "Department occupancy", description = "Active processes per department")
    public Map<Department, Long> occupancy() {
        return service.occupancyByDepartment();
    }

    private static Response rejected(TransitionResult result) {
        return Response.status(ProcessRejectedExceptionMapper.statusFor(result.rejection().errorType()))
                .entity(result)
                .build();
    }
}
