package com.example.pdfrenamer;

import com.example.pdfrenamer.config.RenamerProperties;
import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@OpenAPIDefinition(
        info = @Info(
                title = "PDF Renamer API",
                version = "1.0",
                description = "Reads an identifier from a calibrated region of each PDF's first page and copies the document under that name.",
                contact = @Contact(name = "PDF Renamer")))
@SpringBootApplication
@EnableConfigurationProperties(RenamerProperties.class)
public class PdfRenamerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PdfRenamerApplication.class, args);
    }
}
