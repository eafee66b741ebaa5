package com.example.pdfrenamer.service.document;

import java.io.IOException;
import java.nio.file.Path;

public interface DocumentSource {

    PagedDocument open(Path path) throws IOException;
}
