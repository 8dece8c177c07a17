package com.example.formstructure.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.io.File;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Value("${form-structure.output.base-path:/data/form_structure}")
    private String basePath;

    /**
     * 任务目录下的结果文件：/results/{taskId}/final_structured_document.json
     */
    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        String location = new File(basePath).toURI().toString();
        if (!location.endsWith("/")) {
            location = location + "/";
        }
        registry.addResourceHandler("/results/**")
                .addResourceLocations(location);
    }
}
