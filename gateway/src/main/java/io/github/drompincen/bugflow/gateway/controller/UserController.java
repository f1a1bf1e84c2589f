package io.github.drompincen.bugflow.gateway.controller;

import io.github.drompincen.bugflow.persistence.document.UserDocument;
import io.github.drompincen.bugflow.protocol.api.CreateUserRequest;
import io.github.drompincen.bugflow.protocol.api.UserDto;
import io.github.drompincen.bugflow.runtime.directory.UserService;
import io.github.drompincen.bugflow.runtime.result.LifecycleResult;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/users")
public class UserController {

    private final UserService userService;

    public UserController(UserService userService) {
        this.userService = userService;
    }

    @PostMapping
    public ResponseEntity<Object> create(@Valid @RequestBody CreateUserRequest req) {
        LifecycleResult<UserDocument> result = userService.create(req);
        if (result.isFailure()) {
            return ErrorResponses.of(result.getError());
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(toDto(result.getValue()));
    }

    @GetMapping
    public List<UserDto> list(@RequestParam(required = false) String email) {
        if (email != null && !email.isBlank()) {
            return userService.findByEmail(email).map(this::toDto).stream().toList();
        }
        return userService.findAll().stream().map(this::toDto).toList();
    }

    @GetMapping("/{userId}")
    public ResponseEntity<UserDto> get(@PathVariable String userId) {
        return userService.findById(userId)
                .map(d -> ResponseEntity.ok(toDto(d)))
                .orElse(ResponseEntity.notFound().build());
    }

    private UserDto toDto(UserDocument doc) {
        return new UserDto(doc.getUserId(), doc.getName(), doc.getEmail(), doc.getRole(),
                doc.getCreatedAt(), doc.getUpdatedAt());
    }
}
