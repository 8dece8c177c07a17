package com.example.formstructure;

import com.example.formstructure.service.FormStructureService;
import com.example.formstructure.util.containment.ContainmentConfig;
import com.example.formstructure.util.table.TableLayoutConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "form-structure.table.config-path=classpath-missing/table.json")
class FormStructureApplicationTest {

    @Autowired
    private FormStructureService formStructureService;

    @Autowired
    private ContainmentConfig containmentConfig;

    @Autowired
    private TableLayoutConfig tableLayoutConfig;

    @Test
    void shouldWireCoreComponentsWithDefaults() {
        assertThat(formStructureService).isNotNull();
        assertThat(containmentConfig.getRules()).hasSize(6);
        assertThat(tableLayoutConfig.ROW_TOLERANCE_PX).isEqualTo(5.0);
        assertThat(tableLayoutConfig.UNKNOWN_FIELD_LABEL).isEqualTo("Unknown field");
    }
}
