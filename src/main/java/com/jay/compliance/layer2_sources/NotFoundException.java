package com.jay.compliance.layer2_sources;

public class NotFoundException extends SourceException {

    public NotFoundException(String source, String message) {
        super(source, message, null);
    }

    @Override
    public SourceErrorType getType() {
        return SourceErrorType.NOT_FOUND;
    }
}
