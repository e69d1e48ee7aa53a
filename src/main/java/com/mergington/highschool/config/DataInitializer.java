package com.mergington.highschool.config;

import com.mergington.highschool.model.Activity;
import com.mergington.highschool.model.ScheduleDetails;
import com.mergington.highschool.model.Teacher;
import com.mergington.highschool.model.TeacherRole;
import com.mergington.highschool.repository.ActivityRepository;
import com.mergington.highschool.repository.TeacherRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Seeds the activity catalogue and teacher accounts on first start.
 * Collections that already hold documents are left untouched.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.seed.enabled", havingValue = "true", matchIfMissing = true)
public class DataInitializer implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(DataInitializer.class);

    private final ActivityRepository activityRepository;
    private final TeacherRepository teacherRepository;

    @Override
    public void run(ApplicationArguments args) {
        if (activityRepository.count() == 0) {
            List<Activity> activities = initialActivities();
            activityRepository.saveAll(activities);
            logger.info("Seeded {} activities", activities.size());
        } else {
            logger.info("Activities already present, skipping seed");
        }

        if (teacherRepository.count() == 0) {
            List<Teacher> teachers = initialTeachers();
            teacherRepository.saveAll(teachers);
            logger.info("Seeded {} teacher accounts", teachers.size());
        } else {
            logger.info("Teacher accounts already present, skipping seed");
        }
    }

    List<Activity> initialActivities() {
        return List.of(
                activity("Chess Club", "Learn strategies and compete in chess tournaments",
                        "Mondays and Fridays, 3:15 PM - 4:45 PM", List.of("Monday", "Friday"), "15:15", "16:45", 12,
                        "michael@mergington.edu", "daniel@mergington.edu"),
                activity("Programming Class", "Learn programming fundamentals and build software projects",
                        "Tuesdays and Thursdays, 7:00 AM - 8:00 AM", List.of("Tuesday", "Thursday"), "07:00", "08:00", 20,
                        "emma@mergington.edu", "sophia@mergington.edu"),
                activity("Morning Fitness", "Early morning physical training and exercises",
                        "Mondays, Wednesdays, Fridays, 6:30 AM - 7:45 AM", List.of("Monday", "Wednesday", "Friday"),
                        "06:30", "07:45", 30,
                        "john@mergington.edu", "olivia@mergington.edu"),
                activity("Soccer Team", "Join the school soccer team and compete in matches",
                        "Tuesdays and Thursdays, 3:30 PM - 5:30 PM", List.of("Tuesday", "Thursday"), "15:30", "17:30", 22,
                        "liam@mergington.edu", "noah@mergington.edu"),
                activity("Basketball Team", "Practice and compete in basketball tournaments",
                        "Wednesdays and Fridays, 3:15 PM - 5:00 PM", List.of("Wednesday", "Friday"), "15:15", "17:00", 15,
                        "ava@mergington.edu", "mia@mergington.edu"),
                activity("Art Club", "Explore various art techniques and create masterpieces",
                        "Thursdays, 3:15 PM - 5:00 PM", List.of("Thursday"), "15:15", "17:00", 15,
                        "amelia@mergington.edu", "harper@mergington.edu"),
                activity("Drama Club", "Act, direct, and produce theater performances",
                        "Mondays and Wednesdays, 3:30 PM - 5:30 PM", List.of("Monday", "Wednesday"), "15:30", "17:30", 20,
                        "ella@mergington.edu", "scarlett@mergington.edu"),
                activity("Math Club", "Solve challenging problems and prepare for math competitions",
                        "Tuesdays, 7:15 AM - 8:00 AM", List.of("Tuesday"), "07:15", "08:00", 10,
                        "james@mergington.edu", "benjamin@mergington.edu"),
                activity("Debate Team", "Develop public speaking and argumentation skills",
                        "Fridays, 3:30 PM - 5:30 PM", List.of("Friday"), "15:30", "17:30", 12,
                        "charlotte@mergington.edu", "amelia@mergington.edu"),
                activity("Weekend Robotics Workshop", "Build and program robots in our state-of-the-art workshop",
                        "Saturdays, 10:00 AM - 2:00 PM", List.of("Saturday"), "10:00", "14:00", 15,
                        "ethan@mergington.edu", "oliver@mergington.edu"),
                activity("Science Olympiad", "Weekend science competition preparation for regional and state events",
                        "Saturdays, 1:00 PM - 4:00 PM", List.of("Saturday"), "13:00", "16:00", 18,
                        "isabella@mergington.edu", "lucas@mergington.edu"),
                activity("Sunday Chess Tournament", "Weekly tournament for serious chess players with rankings",
                        "Sundays, 2:00 PM - 5:00 PM", List.of("Sunday"), "14:00", "17:00", 16,
                        "william@mergington.edu", "jacob@mergington.edu"));
    }

    List<Teacher> initialTeachers() {
        return List.of(
                Teacher.builder().username("mrodriguez").displayName("Ms. Rodriguez").role(TeacherRole.TEACHER).build(),
                Teacher.builder().username("mchen").displayName("Mr. Chen").role(TeacherRole.TEACHER).build(),
                Teacher.builder().username("principal").displayName("Principal Martinez").role(TeacherRole.ADMIN).build());
    }

    private Activity activity(String name, String description, String schedule, List<String> days,
            String startTime, String endTime, int maxParticipants, String... participants) {
        return Activity.builder()
                .name(name)
                .description(description)
                .schedule(schedule)
                .scheduleDetails(ScheduleDetails.builder()
                        .days(days)
                        .startTime(startTime)
                        .endTime(endTime)
                        .build())
                .maxParticipants(maxParticipants)
                .participants(new ArrayList<>(List.of(participants)))
                .build();
    }
}
