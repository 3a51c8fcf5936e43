package io.b2mash.collab.member;

import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/users")
public class UserController {

  private final UserService userService;

  public UserController(UserService userService) {
    this.userService = userService;
  }

  @GetMapping
  public ResponseEntity<List<UserSummary>> listUsers() {
    return ResponseEntity.ok(userService.listUsers().stream().map(UserSummary::from).toList());
  }

  @GetMapping("/{id}")
  public ResponseEntity<UserSummary> getUser(@PathVariable Long id) {
    return ResponseEntity.ok(UserSummary.from(userService.getUser(id)));
  }
}
