package com.example.guessIt.Controller;

import com.example.guessIt.DTO.RedeemClaimDTO;
import com.example.guessIt.DTO.RedeemClaimRequest;
import com.example.guessIt.DTO.RedeemDTO;
import com.example.guessIt.Service.RedeemService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/redeems")
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
public class RedeemController {

    private final RedeemService redeemService;

    @GetMapping
    public List<RedeemDTO> getRedeems() {
        return redeemService.getRedeems();
    }

    @PostMapping
    public ResponseEntity<RedeemDTO> addRedeem(@Valid @RequestBody RedeemDTO dto) {
        redeemService.addRedeem(dto);
        return ResponseEntity.status(HttpStatus.CREATED).body(dto);
    }

    @PutMapping("/{name}")
    public ResponseEntity<RedeemDTO> modifyRedeem(@PathVariable String name, @Valid @RequestBody RedeemDTO dto) {
        redeemService.modifyRedeem(name, dto);
        return ResponseEntity.ok(dto);
    }

    @DeleteMapping("/{name}")
    public ResponseEntity<Void> removeRedeem(@PathVariable String name) {
        redeemService.removeRedeem(name);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{name}/redeem")
    public RedeemClaimDTO redeem(@PathVariable String name, @Valid @RequestBody RedeemClaimRequest request) {
        return redeemService.redeem(name, request.getUsername());
    }
}
