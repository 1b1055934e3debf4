package com.shelterops.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class PetException {
    private String day;
    private String startTime;
    private String endTime;
    private String reason; // e.g. "feeding"
}
