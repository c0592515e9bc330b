package com.nipt.orchestrator.api;

import com.nipt.orchestrator.plugin.PackageCatalog;
import com.nipt.orchestrator.support.DenoisePackage;
import com.nipt.orchestrator.support.FmriPackage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Optional;

import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(PackageController.class)
class PackageControllerTest {

    @Autowired   MockMvc        mockMvc;
    @MockitoBean PackageCatalog catalog;

    @BeforeEach
    void setUp() {
        when(catalog.size()).thenReturn(2);
        when(catalog.get(anyInt())).thenReturn(Optional.empty());
        when(catalog.get(0)).thenReturn(Optional.of(new DenoisePackage()));
        when(catalog.get(1)).thenReturn(Optional.of(new FmriPackage()));
    }

    @Test
    void list_returnsIndexTitleAndVersion() throws Exception {
        mockMvc.perform(get("/packages"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].index").value(0))
                .andExpect(jsonPath("$[0].title").value("T1proc"))
                .andExpect(jsonPath("$[1].title").value("fMRI"))
                .andExpect(jsonPath("$[1].version").value("0.3.0"));
    }

    @Test
    void howto_knownIndex_returnsDescription() throws Exception {
        mockMvc.perform(get("/packages/{index}/howto", 0))
                .andExpect(status().isOk())
                .andExpect(content().string(startsWith("T1-weighted preprocessing")));
    }

    @Test
    void howto_unknownIndex_returns404() throws Exception {
        mockMvc.perform(get("/packages/{index}/howto", 9))
                .andExpect(status().isNotFound());
    }
}
