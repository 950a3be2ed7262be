package com.example.identityapi.controller;

import com.example.identityapi.TestUsers;
import com.example.identityapi.config.SecurityConfig;
import com.example.identityapi.dto.PaginationMetadata;
import com.example.identityapi.dto.UserCreationStat;
import com.example.identityapi.dto.UserCreationStatsResponse;
import com.example.identityapi.dto.UserDto;
import com.example.identityapi.dto.UserListResponse;
import com.example.identityapi.dto.UserRequest;
import com.example.identityapi.entity.Role;
import com.example.identityapi.repository.UserRepository;
import com.example.identityapi.security.ActingPrincipal;
import com.example.identityapi.security.SecurityContextHelper;
import com.example.identityapi.service.JwtService;
import com.example.identityapi.service.UserService;
import com.example.identityapi.service.result.ServiceError;
import com.example.identityapi.service.result.ServiceResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

import java.time.LocalDate;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.authentication;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(UserController.class)
@Import({SecurityConfig.class, SecurityContextHelper.class})
class UserControllerTest {

    private final ActingPrincipal admin = ActingPrincipal.of("admin-1", Role.ADMIN);
    private final ActingPrincipal user = ActingPrincipal.of("u1", Role.USER);

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private UserService userService;

    @MockBean
    private JwtService jwtService;

    @MockBean
    private UserRepository userRepository;

    @Test
    void listingRequiresAnAdministrativeRole() throws Exception {
        mockMvc.perform(get("/api/v1/users").with(as(user)))
                .andExpect(status().isForbidden());

        verifyNoInteractions(userService);
    }

    @Test
    void emptyListingIsNoContent() throws Exception {
        when(userService.getUsers(1, 10, null))
                .thenReturn(new UserListResponse(List.of(), new PaginationMetadata(0, 10, 1, 0)));

        mockMvc.perform(get("/api/v1/users").with(as(admin)))
                .andExpect(status().isNoContent());
    }

    @Test
    void listingReturnsUsersAndPaging() throws Exception {
        UserDto dto = UserDto.fromEntity(TestUsers.user("u1", Role.USER));
        when(userService.getUsers(2, 1, 1))
                .thenReturn(new UserListResponse(List.of(dto), new PaginationMetadata(3, 1, 2, 3)));

        mockMvc.perform(get("/api/v1/users")
                        .param("page", "2")
                        .param("pageSize", "1")
                        .param("accountStatus", "1")
                        .with(as(admin)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.users[0].id").value("u1"))
                .andExpect(jsonPath("$.users[0].roles[0]").value("User"))
                .andExpect(jsonPath("$.pagination.currentPage").value(2));
    }

    @Test
    void creationStatsAreListedPerDay() throws Exception {
        when(userService.getUserCreationStats()).thenReturn(new UserCreationStatsResponse(
                List.of(new UserCreationStat(LocalDate.of(2024, 3, 1), 2L))));

        mockMvc.perform(get("/api/v1/users/creation-stats").with(as(admin)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.userCreationStats[0].date").value("2024-03-01"))
                .andExpect(jsonPath("$.userCreationStats[0].count").value(2));
    }

    @Test
    void noCreationStatsIsNoContent() throws Exception {
        when(userService.getUserCreationStats()).thenReturn(new UserCreationStatsResponse(List.of()));

        mockMvc.perform(get("/api/v1/users/creation-stats").with(as(admin)))
                .andExpect(status().isNoContent());
    }

    @Test
    void creationStatsRequireAnAdministrativeRole() throws Exception {
        mockMvc.perform(get("/api/v1/users/creation-stats").with(as(user)))
                .andExpect(status().isForbidden());

        verifyNoInteractions(userService);
    }

    @Test
    void registrationIsPublic() throws Exception {
        UserDto created = UserDto.fromEntity(TestUsers.inactiveUser("new-id"));
        when(userService.createUser(any(UserRequest.class))).thenReturn(ServiceResult.success(created));

        mockMvc.perform(post("/api/v1/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new UserRequest("jdoe", "John", "Doe", "jdoe@example.com", "555-0199", 2))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("new-id"))
                .andExpect(jsonPath("$.accountStatus").value(0));
    }

    @Test
    void registrationWithInvalidEmailFailsValidation() throws Exception {
        mockMvc.perform(post("/api/v1/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new UserRequest("jdoe", "John", "Doe", "not-an-email", "555-0199", 2))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors.email").value("Invalid email format"));
    }

    @Test
    void deletingAnAccountOutsideTheRankIsForbidden() throws Exception {
        when(userService.deleteUser(admin, "admin-2")).thenReturn(ServiceResult.failure(ServiceError.FORBIDDEN));

        mockMvc.perform(delete("/api/v1/users/admin-2").with(as(admin)))
                .andExpect(status().isForbidden());
    }

    @Test
    void activatingAnActiveAccountIsBadRequest() throws Exception {
        when(userService.activateUser(admin, "u1")).thenReturn(ServiceResult.failure(ServiceError.ALREADY_ACTIVATED));

        mockMvc.perform(patch("/api/v1/users/activate/u1").with(as(admin)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("User account is already activated."));
    }

    @Test
    void writeRejectedByTheDatabaseIsConflict() throws Exception {
        when(userService.createUser(any(UserRequest.class)))
                .thenThrow(new DataIntegrityViolationException("duplicate key value violates unique constraint"));

        mockMvc.perform(post("/api/v1/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new UserRequest("jdoe", "John", "Doe", "jdoe@example.com", "555-0199", 2))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("The request conflicts with existing data."));
    }

    @Test
    void oversizedPhoneNumberFailsValidation() throws Exception {
        mockMvc.perform(post("/api/v1/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new UserRequest("jdoe", "John", "Doe", "jdoe@example.com", "1".repeat(31), 2))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors.phoneNumber").value("Phone number must not exceed 30 characters"));

        verifyNoInteractions(userService);
    }

    @Test
    void readingWithoutTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/api/v1/users/u1"))
                .andExpect(status().isUnauthorized());
    }

    private RequestPostProcessor as(ActingPrincipal principal) {
        List<SimpleGrantedAuthority> authorities = principal.roles().stream()
                .map(role -> new SimpleGrantedAuthority("ROLE_" + role.name()))
                .toList();
        return authentication(new UsernamePasswordAuthenticationToken(principal, null, authorities));
    }
}
