package com.bbthechange.tvguide.config;

import com.bbthechange.tvguide.controller.ApiInfoController;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class CorsConfigTest {

    private MockMvc mockMvc(List<String> allowedOrigins) {
        TvGuideProperties properties = new TvGuideProperties();
        properties.getCors().setAllowedOrigins(allowedOrigins);
        return MockMvcBuilders.standaloneSetup(new ApiInfoController())
                .setMessageConverters(new MappingJackson2HttpMessageConverter())
                .addFilters(new CorsConfig().corsFilter(properties))
                .build();
    }

    @Test
    void corsFilter_DefaultWildcard_EchoesAnyOrigin() throws Exception {
        mockMvc(List.of("*")).perform(get("/").header(HttpHeaders.ORIGIN, "https://tv.example.com"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "https://tv.example.com"));
    }

    @Test
    void corsFilter_PreflightForPut_IsAllowed() throws Exception {
        mockMvc(List.of("*")).perform(options("/")
                        .header(HttpHeaders.ORIGIN, "https://tv.example.com")
                        .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "PUT"))
                .andExpect(status().isOk())
                .andExpect(header().exists(HttpHeaders.ACCESS_CONTROL_ALLOW_METHODS));
    }

    @Test
    void corsFilter_UnlistedOrigin_IsRejected() throws Exception {
        mockMvc(List.of("https://tv.example.com")).perform(get("/").header(HttpHeaders.ORIGIN, "https://evil.example.org"))
                .andExpect(status().isForbidden());
    }
}
