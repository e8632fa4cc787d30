package com.team.testcaseimport.service.testimport;

import com.team.testcaseimport.model.patch.PatchOperation;
import com.team.testcaseimport.model.testcase.MappedTestCase;
import com.team.testcaseimport.util.TestStepsXmlEncoder;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 建立單一 Test Case 的 JSON Patch 文件。
 * 建立時使用 add，更新時使用 replace；沒有值的欄位不會出現在文件中。
 */
@Component
public class PatchDocumentBuilder {

    private static final Set<String> FIXED_FIELDS = Set.of(
            "system.title",
            "microsoft.vsts.tcm.steps",
            "microsoft.vsts.common.priority",
            "system.area path",
            "system.areapath",
            "system.iteration path",
            "system.iterationpath",
            "system.description",
            "system.tags",
            "microsoft.vsts.tcm.automationstatus");

    public List<PatchOperation> forCreate(MappedTestCase testCase) {
        return build(testCase, true);
    }

    public List<PatchOperation> forUpdate(MappedTestCase testCase) {
        return build(testCase, false);
    }

    private List<PatchOperation> build(MappedTestCase testCase, boolean create) {
        List<PatchOperation> patch = new ArrayList<>();

        put(patch, create, "System.Title", testCase.getTitle());
        if (hasText(testCase.getSteps())) {
            put(patch, create, TestCaseProjector.STEPS_FIELD, TestStepsXmlEncoder.encode(testCase.getSteps()));
        }
        if (testCase.getPriority() != null) {
            put(patch, create, "Microsoft.VSTS.Common.Priority", testCase.getPriority());
        }
        putIfText(patch, create, "System.AreaPath", testCase.getAreaPath());
        putIfText(patch, create, "System.IterationPath", testCase.getIterationPath());
        putIfText(patch, create, "System.Description", testCase.getDescription());
        putIfText(patch, create, "System.Tags", testCase.getTags());
        putIfText(patch, create, "Microsoft.VSTS.TCM.AutomationStatus", testCase.getAutomationStatus());

        for (Map.Entry<String, String> extra : testCase.getExtraFields().entrySet()) {
            // 固定欄位已在上面處理，避免同一欄位出現兩次
            if (FIXED_FIELDS.contains(extra.getKey().toLowerCase(Locale.ROOT))) {
                continue;
            }
            putIfText(patch, create, extra.getKey(), extra.getValue());
        }
        return patch;
    }

    private void putIfText(List<PatchOperation> patch, boolean create, String referenceName, String value) {
        if (hasText(value)) {
            put(patch, create, referenceName, value);
        }
    }

    private void put(List<PatchOperation> patch, boolean create, String referenceName, Object value) {
        String path = PatchOperation.fieldPath(referenceName);
        patch.add(create ? PatchOperation.add(path, value) : PatchOperation.replace(path, value));
    }

    private boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
