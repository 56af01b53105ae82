package com.flamingo.ai.contextlab.domain.enums;

/** Identifies the capture component that produced a raw context. */
public enum ContextSource {
  /** File read from the local file system. */
  LOCAL_FILE,

  /** File received through an upload. */
  FILE_UPLOAD,

  GOOGLE_DRIVE,
  ONEDRIVE,
  ICLOUD,
  NOTION,
  CHATGPT,
  PERPLEXITY
}
