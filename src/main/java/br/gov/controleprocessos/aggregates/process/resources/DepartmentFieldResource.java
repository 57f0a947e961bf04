package br.gov.controleprocessos.aggregates.process.resources;

import br.gov.controleprocessos.aggregates.process.exceptions.ProcessValidationException;
import br.gov.controleprocessos.aggregates.process.model.DepartmentFieldDefinition;
import br.gov.controleprocessos.aggregates.process.model.enums.Department;
import br.gov.controleprocessos.aggregates.process.model.enums.RejectionReason;
import br.gov.controleprocessos.aggregates.process.services.DepartmentFieldService;
import br.gov.controleprocessos.aggregates.process.services.IdentifierNormalizer;
import br.gov.controleprocessos.aggregates.process.services.dto.FieldDefinitionRequest;
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

@Path("/api/department-fields/{department}")
@RequestScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@Tag(name = "department-fields", description = "Custom attributes recorded per department")
public class DepartmentFieldResource {

    @Inject
    DepartmentFieldService fieldService;

    @Inject
    IdentifierNormalizer normalizer;

    @GET
    @Operation(summary = "List field definitions")
    public List<DepartmentFieldDefinition> list(@PathParam("department") String department) {
        return fieldService.list(department(department));
    }

    @POST
    @Operation(summary = "Define field", description = "Add a custom attribute to a department")
    public Response define(@PathParam("department") String department, @Valid FieldDefinitionRequest request) {
        DepartmentFieldDefinition definition = fieldService.define(department(department),
                request.fieldKey(), request.label(), request.valueKind());
        return Response.status(Response.Status.CREATED).entity(definition).build();
    }

    @DELETE
    @Path("/{fieldKey}")
    @Operation(summary = "Delete field", description = "Delete a field definition and purge its key from process attributes")
    public Map<String, Integer> delete(@PathParam("department") String department, @PathParam("fieldKey") String fieldKey) {
        return Map.of("purged", fieldService.delete(department(department), fieldKey));
    }

    private Department department(String raw) {
        Department department = normalizer.normalizeDepartment(raw, true);
        if (department == null) {
            throw new ProcessValidationException(RejectionReason.INVALID_DEPARTMENT, "Unknown department: " + raw);
        }
        return department;
    }
}
