/*
 * どこで: DDE API
 * 何を: 二重入力 (DDE) の状態参照・遷移・不一致解決・ダッシュボードのエンドポイントを提供する
 * なぜ: アプリの公開インターフェースを明確にするため
 */
package com.example.dde.api;

import com.example.dde.api.request.ResolveDiscrepancyRequest;
import com.example.dde.api.request.SecondEntryRequest;
import com.example.dde.api.response.AuthorizationResponse;
import com.example.dde.api.response.ComparisonResponse;
import com.example.dde.api.response.DashboardResponse;
import com.example.dde.api.response.DdeStatusResponse;
import com.example.dde.api.response.DiscrepanciesResponse;
import com.example.dde.api.response.DiscrepancyResponse;
import com.example.dde.api.response.SecondEntryResponse;
import com.example.dde.service.DdeDashboardService;
import com.example.dde.service.DdeLifecycleService;
import com.example.dde.service.DiscrepancyService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/dde")
@RequiredArgsConstructor
@Validated
public class DdeController {

  private static final String HEADER_USER_ID = "X-User-Id";
  private static final String USER_ID_REQUIRED = "X-User-Id is required";

  private final DdeLifecycleService lifecycleService;
  private final DiscrepancyService discrepancyService;
  private final DdeDashboardService dashboardService;

  @GetMapping("/forms/{form_instance_id}/status")
  public DdeStatusResponse status(@PathVariable("form_instance_id") @Positive long formInstanceId) {
    return lifecycleService.getStatus(formInstanceId);
  }

  @GetMapping("/forms/{form_instance_id}/can-enter")
  public AuthorizationResponse canEnter(
      @PathVariable("form_instance_id") @Positive long formInstanceId,
      @RequestHeader(HEADER_USER_ID) @NotBlank(message = USER_ID_REQUIRED) String userId) {
    return lifecycleService.canEnter(formInstanceId, userId);
  }

  @PostMapping("/forms/{form_instance_id}/first-entry/start")
  public DdeStatusResponse startFirstEntry(
      @PathVariable("form_instance_id") @Positive long formInstanceId,
      @RequestHeader(HEADER_USER_ID) @NotBlank(message = USER_ID_REQUIRED) String userId) {
    return lifecycleService.startFirstEntry(formInstanceId, userId);
  }

  @PostMapping("/forms/{form_instance_id}/first-entry-complete")
  public DdeStatusResponse markFirstEntryComplete(
      @PathVariable("form_instance_id") @Positive long formInstanceId,
      @RequestHeader(HEADER_USER_ID) @NotBlank(message = USER_ID_REQUIRED) String userId) {
    return lifecycleService.markFirstEntryComplete(formInstanceId, userId);
  }

  @PostMapping("/forms/{form_instance_id}/second-entry")
  public SecondEntryResponse submitSecondEntry(
      @PathVariable("form_instance_id") @Positive long formInstanceId,
      @RequestHeader(HEADER_USER_ID) @NotBlank(message = USER_ID_REQUIRED) String userId,
      @Valid @RequestBody SecondEntryRequest request) {
    return lifecycleService.submitSecondEntry(formInstanceId, userId, request.entries());
  }

  @PostMapping("/forms/{form_instance_id}/comparison")
  public ComparisonResponse compare(
      @PathVariable("form_instance_id") @Positive long formInstanceId,
      @RequestHeader(HEADER_USER_ID) @NotBlank(message = USER_ID_REQUIRED) String userId) {
    return lifecycleService.compare(formInstanceId, userId);
  }

  @GetMapping("/forms/{form_instance_id}/discrepancies")
  public DiscrepanciesResponse discrepancies(
      @PathVariable("form_instance_id") @Positive long formInstanceId) {
    return discrepancyService.listByFormInstance(formInstanceId);
  }

  @PostMapping("/discrepancies/{discrepancy_id}/resolve")
  public DiscrepancyResponse resolve(
      @PathVariable("discrepancy_id") @Positive long discrepancyId,
      @RequestHeader(HEADER_USER_ID) @NotBlank(message = USER_ID_REQUIRED) String userId,
      @Valid @RequestBody ResolveDiscrepancyRequest request) {
    return discrepancyService.resolve(
        discrepancyId, request.resolution(), request.newValue(), userId, request.notes());
  }

  @PostMapping("/forms/{form_instance_id}/finalize")
  public DdeStatusResponse finalizeDde(
      @PathVariable("form_instance_id") @Positive long formInstanceId,
      @RequestHeader(HEADER_USER_ID) @NotBlank(message = USER_ID_REQUIRED) String userId) {
    return lifecycleService.finalizeDde(formInstanceId, userId);
  }

  @GetMapping("/dashboard")
  public DashboardResponse dashboard(
      @RequestParam(value = "site_id", required = false) @Positive Long siteId) {
    return dashboardService.overview(siteId);
  }
}
