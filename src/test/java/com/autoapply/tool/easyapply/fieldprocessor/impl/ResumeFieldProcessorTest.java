package com.autoapply.tool.easyapply.fieldprocessor.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import com.autoapply.tool.easyapply.answer.AnswerStore;
import com.autoapply.tool.easyapply.browser.fake.FakeElement;
import com.autoapply.tool.easyapply.fieldprocessor.dto.FieldDescriptor;
import com.autoapply.tool.easyapply.fieldprocessor.enums.FieldKind;

@ExtendWith(MockitoExtension.class)
class ResumeFieldProcessorTest {

  @Mock
  private AnswerStore answerStore;

  @Test
  void leavesThePreselectedResume() {
    FakeElement card = FakeElement.of("div");
    FieldDescriptor field = FieldDescriptor.builder().label("Resume").kind(FieldKind.RESUME)
        .handle(card).build();

    assertThat(new ResumeFieldProcessor().process(field, answerStore)).isTrue();

    assertThat(card.getTotalClicks()).isZero();
    verifyNoInteractions(answerStore);
  }
}
