package com.scholary.video.transcriber.job;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class JobStageTest {

  @Test
  void statusText_shouldFillInDetail() {
    assertThat(JobStage.TRANSCRIBING.statusText("both")).isEqualTo("음성 인식 중... (both)");
    assertThat(JobStage.FETCHING_INFO.statusText("ignored")).isEqualTo("비디오 정보 확인 중...");
  }

  @Test
  void canAdvanceTo_shouldOnlyMoveForward() {
    assertThat(JobStage.SUBMITTED.canAdvanceTo(JobStage.FETCHING_INFO)).isTrue();
    assertThat(JobStage.FETCHING_INFO.canAdvanceTo(JobStage.FETCHING_INFO)).isTrue();
    assertThat(JobStage.TRANSCRIBING.canAdvanceTo(JobStage.EXTRACTING_AUDIO)).isFalse();
    assertThat(JobStage.EXTRACTING_AUDIO.canAdvanceTo(JobStage.FAILED)).isTrue();
  }

  @Test
  void canAdvanceTo_shouldRejectEverythingFromTerminalStage() {
    assertThat(JobStage.COMPLETED.canAdvanceTo(JobStage.FAILED)).isFalse();
    assertThat(JobStage.FAILED.canAdvanceTo(JobStage.FAILED)).isFalse();
  }
}
