package com.gocardless.client.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.gocardless.client.client.ApiClient;
import com.gocardless.client.client.ApiRequest;
import com.gocardless.client.enums.Scheme;
import com.gocardless.client.model.BankDetailsLookupCreateRequest;
import com.gocardless.client.model.BankDetailsLookupResponse;
import com.gocardless.client.resources.BankDetailsLookup;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpMethod;

@DisplayName("BankDetailsLookupService")
@ExtendWith(MockitoExtension.class)
class BankDetailsLookupServiceTest {

  @Mock
  private ApiClient apiClient;
  @Captor
  private ArgumentCaptor<ApiRequest<BankDetailsLookupResponse>> requestCaptor;

  @Test
  @DisplayName("Should POST the bank details and return the supported schemes")
  void shouldLookUpBankDetails() {
    // given
    BankDetailsLookup lookup = new BankDetailsLookup();
    lookup.setAvailableDebitSchemes(List.of(Scheme.BACS));
    lookup.setBankName("BARCLAYS BANK PLC");
    BankDetailsLookupResponse stub = new BankDetailsLookupResponse();
    stub.setBankDetailsLookup(lookup);
    when(apiClient.execute(any())).thenReturn(stub);

    BankDetailsLookupCreateRequest request = new BankDetailsLookupCreateRequest();
    request.setCountryCode("GB");
    request.setAccountNumber("55779911");
    request.setBranchCode("200000");

    // when
    BankDetailsLookupResponse response = new BankDetailsLookupService(apiClient).create(request);

    // then
    assertEquals(List.of(Scheme.BACS), response.getBankDetailsLookup().getAvailableDebitSchemes());
    verify(apiClient).execute(requestCaptor.capture());
    ApiRequest<BankDetailsLookupResponse> sent = requestCaptor.getValue();
    assertEquals(HttpMethod.POST, sent.getMethod());
    assertEquals("/bank_details_lookups", sent.getPathTemplate());
    assertEquals("bank_details_lookups", sent.getEnvelope());
    assertSame(request, sent.getRequestObject());
    assertNull(sent.getConflictHandler());
  }
}
