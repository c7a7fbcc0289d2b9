/*
 * どこで: Enterprise API
 * 何を: ライセンスの Activate/Deactivate/GetState エンドポイントを提供する
 * なぜ: アプリの公開インターフェースを明確にするため
 */
package com.example.enterprise.server.api;

import com.example.enterprise.server.service.EntitlementService;

import lombok.RequiredArgsConstructor;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/enterprise")
@RequiredArgsConstructor
public class EntitlementController {

    private final EntitlementService entitlementService;

    @PostMapping("/activate")
    public ResponseEntity<Void> activate(@RequestBody ActivateRequest request) {
        entitlementService.activate(request.activationCode(), request.expires());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/deactivate")
    public ResponseEntity<Void> deactivate() {
        entitlementService.deactivate();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/state")
    public EnterpriseStateResponse state() {
        return EnterpriseStateResponse.from(entitlementService.getState());
    }
}
