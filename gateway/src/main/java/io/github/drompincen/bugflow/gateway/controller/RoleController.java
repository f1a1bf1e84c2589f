package io.github.drompincen.bugflow.gateway.controller;

import io.github.drompincen.bugflow.protocol.api.RolePermissions;
import io.github.drompincen.bugflow.protocol.api.UserRole;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/roles")
public class RoleController {

    @GetMapping("/{role}/permissions")
    public RolePermissions permissions(@PathVariable UserRole role) {
        return role.permissions();
    }
}
