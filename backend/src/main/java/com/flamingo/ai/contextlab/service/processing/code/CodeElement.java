package com.flamingo.ai.contextlab.service.processing.code;

/** A definition found by the line scanner: its kind, name and zero-based line. */
record CodeElement(String type, String name, int line) {}
