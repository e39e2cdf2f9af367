package com.phillippitts.voiceinput.domain;

/** Local availability of a model artifact. */
public enum DownloadState { ABSENT, DOWNLOADING, PRESENT, FAILED }
