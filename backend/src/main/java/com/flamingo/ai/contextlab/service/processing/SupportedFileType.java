package com.flamingo.ai.contextlab.service.processing;

/**
 * One extension handled by a registered processor, for upstream type reporting.
 *
 * @param extension lowercase extension with leading dot
 * @param processor processor name
 * @param description processor description
 */
public record SupportedFileType(String extension, String processor, String description) {}
