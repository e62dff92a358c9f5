package io.github.cyfko.mqlfilter.jpa.entities;

import jakarta.persistence.*;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

@Entity
@Table(name = "employee")
public class Employee {

    @Id
    private Long employeeId;

    private String firstName;

    private String lastName;

    private Boolean active;

    @Enumerated(EnumType.STRING)
    private Role role;

    private LocalDateTime birthDate;

    private LocalDate hireDate;

    private LocalTime shiftStart;

    @Lob
    private byte[] photo;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "reports_to")
    private Employee parent;

    protected Employee() {
    }

    public Employee(Long employeeId, String firstName, String lastName, Boolean active, Role role,
                    LocalDateTime birthDate, LocalDate hireDate, LocalTime shiftStart, Employee parent) {
        this.employeeId = employeeId;
        this.firstName = firstName;
        this.lastName = lastName;
        this.active = active;
        this.role = role;
        this.birthDate = birthDate;
        this.hireDate = hireDate;
        this.shiftStart = shiftStart;
        this.parent = parent;
    }

    public Long getEmployeeId() {
        return employeeId;
    }

    public String getFirstName() {
        return firstName;
    }

    public String getLastName() {
        return lastName;
    }

    public Boolean getActive() {
        return active;
    }

    public Role getRole() {
        return role;
    }

    public Employee getParent() {
        return parent;
    }

    public enum Role {
        GENERAL_MANAGER, SALES_MANAGER, SALES_SUPPORT
    }
}
