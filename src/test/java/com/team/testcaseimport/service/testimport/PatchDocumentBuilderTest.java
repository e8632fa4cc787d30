package com.team.testcaseimport.service.testimport;

import com.team.testcaseimport.model.patch.PatchOperation;
import com.team.testcaseimport.model.testcase.MappedTestCase;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PatchDocumentBuilderTest {

    private final PatchDocumentBuilder builder = new PatchDocumentBuilder();

    private static MappedTestCase fullCase() {
        Map<String, String> extras = new LinkedHashMap<>();
        extras.put("Custom.RiskLevel", "High");
        extras.put("system.tags", "duplicate");
        extras.put("Custom.Empty", " ");
        return MappedTestCase.builder()
                .rowIndex(2)
                .title("Login works")
                .steps("1. Open app|App launches")
                .priority(2)
                .areaPath("Web\\Auth")
                .tags("smoke; login")
                .extraFields(extras)
                .build();
    }

    @Test
    void createUsesAddInFixedOrder() {
        List<PatchOperation> patch = builder.forCreate(fullCase());

        assertThat(patch).extracting(PatchOperation::getPath).containsExactly(
                "/fields/System.Title",
                "/fields/Microsoft.VSTS.TCM.Steps",
                "/fields/Microsoft.VSTS.Common.Priority",
                "/fields/System.AreaPath",
                "/fields/System.Tags",
                "/fields/Custom.RiskLevel");
        assertThat(patch).extracting(PatchOperation::getOp).containsOnly(PatchOperation.Op.ADD);
        assertThat(patch.get(1).getValue().toString()).startsWith("<steps id=\"0\" last=\"1\">");
        assertThat(patch.get(2).getValue()).isEqualTo(2);
    }

    @Test
    void updateUsesReplace() {
        List<PatchOperation> patch = builder.forUpdate(MappedTestCase.builder().title("T").id("5").build());

        assertThat(patch).containsExactly(PatchOperation.replace("/fields/System.Title", "T"));
    }

    @Test
    void removeCarriesNoValueAndAddRequiresOne() {
        PatchOperation remove = PatchOperation.remove("/fields/System.Tags");

        assertThat(remove.getOp()).isEqualTo(PatchOperation.Op.REMOVE);
        assertThat(remove.getValue()).isNull();
        assertThatThrownBy(() -> PatchOperation.add("/fields/System.Title", null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void extraFieldDuplicatingFixedFieldIsSkipped() {
        List<PatchOperation> patch = builder.forCreate(fullCase());

        assertThat(patch).filteredOn(op -> op.getPath().equalsIgnoreCase("/fields/System.Tags"))
                .singleElement()
                .extracting(PatchOperation::getValue).isEqualTo("smoke; login");
    }
}
