package com.scholary.video.transcriber.job;

/**
 * Pipeline stages of a transcription job, in the order a job moves through them.
 *
 * <p>Each stage carries the human-readable status text shown to polling clients. Some texts take
 * a detail argument (the audio format or the transcription method).
 */
public enum JobStage {
  SUBMITTED("작업 대기 중..."),
  FETCHING_INFO("비디오 정보 확인 중..."),
  EXTRACTING_AUDIO("오디오 추출 중... (%s)"),
  TRANSCRIBING("음성 인식 중... (%s)"),
  SUMMARIZING("요약 중..."),
  COMPLETED("변환 완료!"),
  FAILED("변환 실패");

  private final String statusTemplate;

  JobStage(String statusTemplate) {
    this.statusTemplate = statusTemplate;
  }

  public String statusText() {
    return statusText(null);
  }

  /** Status text for this stage, filling in the detail when the stage takes one. */
  public String statusText(String detail) {
    if (!statusTemplate.contains("%s")) {
      return statusTemplate;
    }
    return String.format(statusTemplate, detail == null ? "" : detail);
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  /** Stages only move forward; a terminal stage accepts nothing. */
  public boolean canAdvanceTo(JobStage next) {
    return !isTerminal() && next.ordinal() >= ordinal();
  }
}
